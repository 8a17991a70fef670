package com.hhplus.conference.application.checkout;

import com.hhplus.conference.application.checkout.dto.CheckoutCommand;
import com.hhplus.conference.application.order.dto.OrderResult;
import com.hhplus.conference.common.exception.ApplicationException;
import com.hhplus.conference.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * CheckoutService - 체크아웃 진입점 (Application 계층)
 *
 * 아키텍처:
 * CheckoutService (트랜잭션 없음)
 *     ↓
 * CheckoutTransactionService (@Transactional + @Retryable)
 */
@Slf4j
@Service
public class CheckoutService {

    private final CheckoutTransactionService checkoutTransactionService;

    public CheckoutService(CheckoutTransactionService checkoutTransactionService) {
        this.checkoutTransactionService = checkoutTransactionService;
    }

    public OrderResult checkout(CheckoutCommand command) {
        try {
            return checkoutTransactionService.checkout(command);
        } catch (DataIntegrityViolationException e) {
            log.error("[CheckoutService] 체크아웃 제약 위반, 재시도 소진 - userId={}, conference={}",
                    command.getUserId(), command.getConferenceSlug(), e);
            throw new ApplicationException(ErrorCode.ORDER_REFERENCE_GENERATION_FAILED,
                    "userId=" + command.getUserId(), e);
        }
    }
}
