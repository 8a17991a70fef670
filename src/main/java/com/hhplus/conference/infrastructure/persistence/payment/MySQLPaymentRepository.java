package com.hhplus.conference.infrastructure.persistence.payment;

import com.hhplus.conference.domain.payment.Payment;
import com.hhplus.conference.domain.payment.PaymentMethod;
import com.hhplus.conference.domain.payment.PaymentRepository;
import com.hhplus.conference.domain.payment.PaymentStatus;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

@Repository
public class MySQLPaymentRepository implements PaymentRepository {

    private final PaymentJpaRepository paymentJpaRepository;

    public MySQLPaymentRepository(PaymentJpaRepository paymentJpaRepository) {
        this.paymentJpaRepository = paymentJpaRepository;
    }

    @Override
    public Payment save(Payment payment) {
        return paymentJpaRepository.save(payment);
    }

    @Override
    public Optional<Payment> findByPaymentIntentIdForUpdate(String paymentIntentId) {
        return paymentJpaRepository.findByIntentIdWithLock(paymentIntentId);
    }

    @Override
    public List<Payment> findByOrderId(Long orderId) {
        return paymentJpaRepository.findByOrderIdOrderByPaymentIdAsc(orderId);
    }

    @Override
    public List<Payment> findByOrderIdAndMethodAndStatus(Long orderId, PaymentMethod method, PaymentStatus status) {
        return paymentJpaRepository.findByOrderIdAndMethodAndStatus(orderId, method, status);
    }

    @Override
    public BigDecimal sumSucceededAmount(Long orderId) {
        BigDecimal sum = paymentJpaRepository.sumAmountByOrderIdAndStatus(orderId, PaymentStatus.SUCCEEDED);
        return sum == null ? BigDecimal.ZERO.setScale(2) : sum;
    }
}
