package com.hhplus.conference.application.order;

import com.hhplus.conference.application.order.dto.OrderResult;
import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.common.exception.RegistrationValidationException;
import com.hhplus.conference.domain.credit.Credit;
import com.hhplus.conference.domain.credit.CreditNotFoundException;
import com.hhplus.conference.domain.credit.CreditRepository;
import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderNotFoundException;
import com.hhplus.conference.domain.order.OrderRepository;
import com.hhplus.conference.domain.payment.Payment;
import com.hhplus.conference.domain.payment.PaymentMethod;
import com.hhplus.conference.domain.payment.PaymentRepository;
import com.hhplus.conference.domain.payment.PaymentStatus;
import com.hhplus.conference.domain.voucher.VoucherRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * OrderLedgerService - 주문 취소와 크레딧 적용 (Application 계층)
 *
 * 핵심 비즈니스 규칙:
 * - 취소는 PENDING 에서만 가능하며 바우처 사용 횟수를 되돌린다 (0 미만으로 내려가지 않음)
 * - 취소된 주문에 적용됐던 크레딧은 다시 AVAILABLE 로 돌아간다
 * - 크레딧은 같은 사용자, 같은 컨퍼런스의 PENDING 주문에만 적용
 * - 적용액 = min(크레딧 금액, 남은 잔액), 잔액이 모두 채워지면 PAID
 *
 * 동시성 제어:
 * - 주문 → 크레딧 순서로 FOR UPDATE 잠금
 */
@Slf4j
@Service
public class OrderLedgerService {

    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;
    private final CreditRepository creditRepository;
    private final VoucherRepository voucherRepository;
    private final OrderSettlementService orderSettlementService;
    private final Clock clock;

    public OrderLedgerService(OrderRepository orderRepository,
                              PaymentRepository paymentRepository,
                              CreditRepository creditRepository,
                              VoucherRepository voucherRepository,
                              OrderSettlementService orderSettlementService,
                              Clock clock) {
        this.orderRepository = orderRepository;
        this.paymentRepository = paymentRepository;
        this.creditRepository = creditRepository;
        this.voucherRepository = voucherRepository;
        this.orderSettlementService = orderSettlementService;
        this.clock = clock;
    }

    /**
     * 주문 취소 (PENDING → CANCELLED)
     *
     * 재고는 별도 복구 작업 없이 확정 수량 집계에서 자동으로 빠진다.
     *
     * @throws com.hhplus.conference.domain.order.IllegalOrderTransitionException PENDING 이 아닌 경우
     */
    @Transactional
    public OrderResult cancelOrder(Long userId, Long orderId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Order order = findOwnedOrderForUpdate(userId, orderId);

        order.cancel(now);
        orderRepository.save(order);

        if (order.hasVoucher()) {
            voucherRepository.findByConferenceIdAndCode(order.getConferenceId(), order.getVoucherCode())
                    .ifPresent(voucher -> {
                        int released = voucherRepository.decrementUsage(voucher.getVoucherId());
                        log.info("[OrderLedgerService] 바우처 사용 반환 - orderId={}, voucherCode={}, released={}",
                                orderId, voucher.getCode(), released);
                    });
        }

        for (Payment payment : paymentRepository.findByOrderIdAndMethodAndStatus(
                orderId, PaymentMethod.CREDIT, PaymentStatus.SUCCEEDED)) {
            payment.markRefunded(now);
            paymentRepository.save(payment);
            creditRepository.findByIdForUpdate(payment.getCreditId()).ifPresent(credit -> {
                credit.restore(now);
                creditRepository.save(credit);
                log.info("[OrderLedgerService] 크레딧 복구 - orderId={}, creditId={}", orderId, credit.getCreditId());
            });
        }

        log.info("[OrderLedgerService] 주문 취소 - orderId={}, reference={}", orderId, order.getReference());
        return OrderResult.from(order);
    }

    /**
     * 크레딧 적용
     *
     * @throws RegistrationValidationException 주문이 PENDING 이 아니거나, 크레딧을 쓸 수 없거나, 이미 전액 결제된 경우
     */
    @Transactional
    public OrderResult applyCredit(Long userId, Long orderId, Long creditId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Order order = findOwnedOrderForUpdate(userId, orderId);
        if (!order.isPending()) {
            throw new RegistrationValidationException(ErrorCode.ORDER_NOT_PENDING,
                    "orderId=" + orderId + ", status=" + order.getStatus());
        }

        Credit credit = creditRepository.findByIdForUpdate(creditId)
                .orElseThrow(() -> new CreditNotFoundException(creditId));
        if (!credit.isAvailable() || !credit.belongsTo(order.getUserId(), order.getConferenceId())) {
            throw new RegistrationValidationException(ErrorCode.CREDIT_NOT_APPLICABLE,
                    "creditId=" + creditId + ", status=" + credit.getStatus());
        }

        BigDecimal remaining = orderSettlementService.remainingBalance(order);
        if (remaining.signum() <= 0) {
            throw new RegistrationValidationException(ErrorCode.ORDER_ALREADY_PAID, "orderId=" + orderId);
        }

        BigDecimal applied = credit.getAmount().min(remaining);
        paymentRepository.save(Payment.succeededCredit(orderId, creditId, applied, now));
        credit.applyTo(orderId, now);
        creditRepository.save(credit);
        log.info("[OrderLedgerService] 크레딧 적용 - orderId={}, creditId={}, applied={}, remainingBefore={}",
                orderId, creditId, applied, remaining);

        orderSettlementService.settleIfCovered(order, now);
        return OrderResult.from(order);
    }

    private Order findOwnedOrderForUpdate(Long userId, Long orderId) {
        return orderRepository.findByIdForUpdate(orderId)
                .filter(order -> order.getUserId().equals(userId))
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
