package com.hhplus.conference.domain.payment;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Payment - 주문에 대한 단일 금전 이동
 *
 * 비즈니스 규칙:
 * - 하나의 주문은 여러 결제를 가질 수 있다 (크레딧 + Stripe 등)
 * - Stripe 결제는 PaymentIntent id로 식별하며 웹훅은 이 id로 upsert 한다
 * - 상태는 해당 결제를 소유한 처리기(웹훅 핸들러, 주문 원장)만 변경한다
 */
@Entity
@Table(name = "payments",
        uniqueConstraints = @UniqueConstraint(name = "uk_payment_intent", columnNames = "stripe_payment_intent_id"),
        indexes = @Index(name = "idx_payment_order", columnList = "order_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "payment_id")
    private Long paymentId;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "method", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private PaymentMethod method;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private PaymentStatus status;

    @Column(name = "amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "stripe_payment_intent_id", length = 200)
    private String stripePaymentIntentId;

    @Column(name = "stripe_charge_id", length = 200)
    private String stripeChargeId;

    @Column(name = "credit_id")
    private Long creditId;

    @Column(name = "reference", length = 200)
    private String reference;

    @Column(name = "note", columnDefinition = "TEXT")
    private String note;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Payment pendingStripe(Long orderId, BigDecimal amount, String paymentIntentId, LocalDateTime now) {
        return Payment.builder()
                .orderId(orderId)
                .method(PaymentMethod.STRIPE)
                .status(PaymentStatus.PENDING)
                .amount(amount)
                .stripePaymentIntentId(paymentIntentId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public static Payment succeededStripe(Long orderId, BigDecimal amount, String paymentIntentId,
                                          String chargeId, LocalDateTime now) {
        return Payment.builder()
                .orderId(orderId)
                .method(PaymentMethod.STRIPE)
                .status(PaymentStatus.SUCCEEDED)
                .amount(amount)
                .stripePaymentIntentId(paymentIntentId)
                .stripeChargeId(chargeId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public static Payment succeededCredit(Long orderId, Long creditId, BigDecimal amount, LocalDateTime now) {
        return Payment.builder()
                .orderId(orderId)
                .method(PaymentMethod.CREDIT)
                .status(PaymentStatus.SUCCEEDED)
                .amount(amount)
                .creditId(creditId)
                .reference("credit-" + creditId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public static Payment comp(Long orderId, LocalDateTime now) {
        return Payment.builder()
                .orderId(orderId)
                .method(PaymentMethod.COMP)
                .status(PaymentStatus.SUCCEEDED)
                .amount(BigDecimal.ZERO.setScale(2))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public static Payment manual(Long orderId, BigDecimal amount, String reference, String note, LocalDateTime now) {
        return Payment.builder()
                .orderId(orderId)
                .method(PaymentMethod.MANUAL)
                .status(PaymentStatus.SUCCEEDED)
                .amount(amount)
                .reference(reference)
                .note(note)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void markSucceeded(BigDecimal amount, String chargeId, LocalDateTime now) {
        this.status = PaymentStatus.SUCCEEDED;
        this.amount = amount;
        if (chargeId != null && !chargeId.isBlank()) {
            this.stripeChargeId = chargeId;
        }
        this.updatedAt = now;
    }

    public void markFailed(LocalDateTime now) {
        this.status = PaymentStatus.FAILED;
        this.updatedAt = now;
    }

    public void markRefunded(LocalDateTime now) {
        this.status = PaymentStatus.REFUNDED;
        this.updatedAt = now;
    }

    public boolean isSucceeded() {
        return status == PaymentStatus.SUCCEEDED;
    }
}
