package com.hhplus.conference.infrastructure.persistence.payment;

import com.hhplus.conference.domain.payment.Payment;
import com.hhplus.conference.domain.payment.PaymentMethod;
import com.hhplus.conference.domain.payment.PaymentStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Payment JPA Repository
 */
public interface PaymentJpaRepository extends JpaRepository<Payment, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.stripePaymentIntentId = :intentId")
    Optional<Payment> findByIntentIdWithLock(@Param("intentId") String intentId);

    List<Payment> findByOrderIdOrderByPaymentIdAsc(Long orderId);

    List<Payment> findByOrderIdAndMethodAndStatus(Long orderId, PaymentMethod method, PaymentStatus status);

    @Query("SELECT SUM(p.amount) FROM Payment p WHERE p.orderId = :orderId AND p.status = :status")
    BigDecimal sumAmountByOrderIdAndStatus(@Param("orderId") Long orderId, @Param("status") PaymentStatus status);
}
