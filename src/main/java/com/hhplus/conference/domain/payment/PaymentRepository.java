package com.hhplus.conference.domain.payment;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Payment Repository Interface (Domain Layer - Port)
 */
public interface PaymentRepository {

    Payment save(Payment payment);

    /**
     * PaymentIntent id 기준 비관적 락 조회 (웹훅 upsert 용)
     */
    Optional<Payment> findByPaymentIntentIdForUpdate(String paymentIntentId);

    List<Payment> findByOrderId(Long orderId);

    List<Payment> findByOrderIdAndMethodAndStatus(Long orderId, PaymentMethod method, PaymentStatus status);

    /**
     * 주문의 SUCCEEDED 결제 합계 (없으면 0)
     */
    BigDecimal sumSucceededAmount(Long orderId);
}
