package com.hhplus.conference.application.cart;

import com.hhplus.conference.application.cart.dto.CartSummary;
import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.common.exception.RegistrationValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * CartService - 장바구니 유스케이스 진입점 (Application 계층)
 *
 * 아키텍처:
 * CartService (트랜잭션 없음, 예외 변환)
 *     ↓
 * CartTransactionService (@Transactional + @Retryable)
 *
 * 재시도까지 소진된 유니크 제약 위반은 500 이 아니라 검증 실패(409)로 돌려준다.
 */
@Slf4j
@Service
public class CartService {

    private final CartTransactionService cartTransactionService;

    public CartService(CartTransactionService cartTransactionService) {
        this.cartTransactionService = cartTransactionService;
    }

    public CartSummary getCart(Long userId, String conferenceSlug) {
        return translateConflict(userId, () -> cartTransactionService.getCart(userId, conferenceSlug));
    }

    public CartSummary addTicket(Long userId, String conferenceSlug, Long ticketTypeId, int quantity) {
        return translateConflict(userId,
                () -> cartTransactionService.addTicket(userId, conferenceSlug, ticketTypeId, quantity));
    }

    public CartSummary addAddOn(Long userId, String conferenceSlug, Long addOnId, int quantity) {
        return translateConflict(userId,
                () -> cartTransactionService.addAddOn(userId, conferenceSlug, addOnId, quantity));
    }

    public CartSummary removeItem(Long userId, String conferenceSlug, Long cartItemId) {
        return translateConflict(userId,
                () -> cartTransactionService.removeItem(userId, conferenceSlug, cartItemId));
    }

    public CartSummary updateQuantity(Long userId, String conferenceSlug, Long cartItemId, int quantity) {
        return translateConflict(userId,
                () -> cartTransactionService.updateQuantity(userId, conferenceSlug, cartItemId, quantity));
    }

    public CartSummary applyVoucher(Long userId, String conferenceSlug, String code) {
        return translateConflict(userId, () -> cartTransactionService.applyVoucher(userId, conferenceSlug, code));
    }

    private CartSummary translateConflict(Long userId, Supplier<CartSummary> action) {
        try {
            return action.get();
        } catch (DataIntegrityViolationException e) {
            log.warn("[CartService] 동시 변경 충돌, 재시도 소진 - userId={}", userId, e);
            throw new RegistrationValidationException(ErrorCode.CONCURRENT_MODIFICATION, "userId=" + userId, e);
        }
    }
}
