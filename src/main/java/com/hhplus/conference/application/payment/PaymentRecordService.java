package com.hhplus.conference.application.payment;

import com.hhplus.conference.application.order.OrderSettlementService;
import com.hhplus.conference.application.order.dto.OrderResult;
import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.common.exception.RegistrationValidationException;
import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderNotFoundException;
import com.hhplus.conference.domain.order.OrderRepository;
import com.hhplus.conference.domain.payment.Payment;
import com.hhplus.conference.domain.payment.PaymentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * PaymentRecordService - 결제 기록 트랜잭션
 *
 * - PENDING Stripe 결제 기록 (PaymentIntent 생성 직후)
 * - comp 결제 (총액 0 주문)
 * - 수동 결제 (계좌이체 등 운영자 입력)
 */
@Slf4j
@Service
public class PaymentRecordService {

    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;
    private final OrderSettlementService orderSettlementService;
    private final Clock clock;

    public PaymentRecordService(OrderRepository orderRepository,
                                PaymentRepository paymentRepository,
                                OrderSettlementService orderSettlementService,
                                Clock clock) {
        this.orderRepository = orderRepository;
        this.paymentRepository = paymentRepository;
        this.orderSettlementService = orderSettlementService;
        this.clock = clock;
    }

    /**
     * 같은 intent id 로 이미 기록돼 있으면 아무것도 하지 않는다 (idempotency key 로 같은 intent 가 돌아온 경우)
     */
    @Transactional
    public void recordPendingIntent(Long orderId, BigDecimal amount, String paymentIntentId) {
        if (paymentRepository.findByPaymentIntentIdForUpdate(paymentIntentId).isPresent()) {
            log.debug("[PaymentRecordService] 이미 기록된 PaymentIntent - orderId={}, intentId={}", orderId, paymentIntentId);
            return;
        }
        paymentRepository.save(Payment.pendingStripe(orderId, amount, paymentIntentId, LocalDateTime.now(clock)));
        log.info("[PaymentRecordService] PENDING 결제 기록 - orderId={}, intentId={}, amount={}",
                orderId, paymentIntentId, amount);
    }

    /**
     * comp 결제: 총액이 0 인 PENDING 주문만
     */
    @Transactional
    public OrderResult recordComp(Long orderId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Order order = findPendingForUpdate(orderId);
        if (order.getTotal().signum() != 0) {
            throw new RegistrationValidationException(ErrorCode.INVALID_PAYMENT_AMOUNT,
                    "comp 결제는 총액 0 주문에만 가능합니다 - total=" + order.getTotal());
        }
        paymentRepository.save(Payment.comp(orderId, now));
        orderSettlementService.markPaid(order, now);
        return OrderResult.from(order);
    }

    /**
     * 수동 결제: 누적 성공 결제가 총액 이상이 되면 PAID
     */
    @Transactional
    public OrderResult recordManual(Long orderId, BigDecimal amount, String reference, String note) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (amount == null || amount.signum() <= 0) {
            throw new RegistrationValidationException(ErrorCode.INVALID_PAYMENT_AMOUNT, "amount=" + amount);
        }
        Order order = findPendingForUpdate(orderId);
        paymentRepository.save(Payment.manual(orderId, amount, reference, note, now));
        log.info("[PaymentRecordService] 수동 결제 기록 - orderId={}, amount={}, reference={}", orderId, amount, reference);
        orderSettlementService.settleIfCovered(order, now);
        return OrderResult.from(order);
    }

    private Order findPendingForUpdate(Long orderId) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        if (!order.isPending()) {
            throw new RegistrationValidationException(ErrorCode.ORDER_NOT_PENDING,
                    "orderId=" + orderId + ", status=" + order.getStatus());
        }
        return order;
    }
}
