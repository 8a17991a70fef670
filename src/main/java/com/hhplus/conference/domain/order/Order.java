package com.hhplus.conference.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 체크아웃 시점의 금액, 바우처, 라인 스냅샷 보관
 * - 상태 전환 규칙 집행 (OrderStatus.canTransitionTo)
 * - 재고 보류(holdExpiresAt) 관리
 *
 * 핵심 비즈니스 규칙:
 * - total = subtotal − discountAmount, 음수 불가
 * - 바우처는 코드, 유형, 값만 복사해 두고 원본을 참조하지 않는다
 * - PAID 도달 시 보류 해제 (holdExpiresAt = null)
 */
@Entity
@Table(name = "orders",
        uniqueConstraints = @UniqueConstraint(name = "uk_order_reference", columnNames = "reference"),
        indexes = {
                @Index(name = "idx_order_user_conference", columnList = "user_id, conference_id"),
                @Index(name = "idx_order_status_hold", columnList = "status, hold_expires_at")
        })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "conference_id", nullable = false)
    private Long conferenceId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "status", nullable = false, length = 30)
    @Enumerated(EnumType.STRING)
    private OrderStatus status;

    @Column(name = "subtotal", nullable = false, precision = 10, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "discount_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal discountAmount;

    @Column(name = "total", nullable = false, precision = 10, scale = 2)
    private BigDecimal total;

    @Column(name = "voucher_code", length = 100)
    private String voucherCode;

    /**
     * 바우처 스냅샷 ("PERCENTAGE:20.00" 형식)
     */
    @Column(name = "voucher_details", length = 200)
    private String voucherDetails;

    @Column(name = "reference", nullable = false, length = 50, updatable = false)
    private String reference;

    @Column(name = "hold_expires_at")
    private LocalDateTime holdExpiresAt;

    @Column(name = "billing_name", length = 200)
    private String billingName;

    @Column(name = "billing_email", length = 200)
    private String billingEmail;

    @Column(name = "billing_company", length = 200)
    private String billingCompany;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 주문 라인 관계 (생성 시에만 함께 저장, 이후 변경 없음)
     */
    @OneToMany(cascade = CascadeType.PERSIST, fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    @Builder.Default
    private List<OrderLineItem> lineItems = new ArrayList<>();

    /**
     * PENDING 주문 생성 (정적 팩토리)
     *
     * @throws IllegalArgumentException 할인액이 음수이거나 subtotal을 초과하는 경우
     */
    public static Order createPending(Long conferenceId, Long userId, String reference,
                                      BigDecimal subtotal, BigDecimal discountAmount,
                                      String voucherCode, String voucherDetails,
                                      LocalDateTime holdExpiresAt, LocalDateTime now) {
        if (discountAmount.signum() < 0) {
            throw new IllegalArgumentException("할인액은 음수가 될 수 없습니다");
        }
        BigDecimal total = subtotal.subtract(discountAmount);
        if (total.signum() < 0) {
            throw new IllegalArgumentException("최종 금액은 음수가 될 수 없습니다");
        }
        return Order.builder()
                .conferenceId(conferenceId)
                .userId(userId)
                .reference(reference)
                .status(OrderStatus.PENDING)
                .subtotal(subtotal)
                .discountAmount(discountAmount)
                .total(total)
                .voucherCode(voucherCode)
                .voucherDetails(voucherDetails)
                .holdExpiresAt(holdExpiresAt)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void addLineItem(OrderLineItem lineItem) {
        if (lineItem == null) {
            throw new IllegalArgumentException("null 주문 라인을 추가할 수 없습니다");
        }
        this.lineItems.add(lineItem);
    }

    public List<OrderLineItem> getLineItems() {
        return Collections.unmodifiableList(lineItems);
    }

    public void withBilling(String billingName, String billingEmail, String billingCompany) {
        this.billingName = billingName;
        this.billingEmail = billingEmail;
        this.billingCompany = billingCompany;
    }

    /**
     * 상태 전환 공통 경로
     *
     * @throws IllegalOrderTransitionException 허용되지 않은 전환 (상태는 변경되지 않음)
     */
    public void transitionTo(OrderStatus target, LocalDateTime now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalOrderTransitionException(orderId, status, target);
        }
        this.status = target;
        this.updatedAt = now;
    }

    /**
     * 상태 전환: PENDING → PAID, 재고 보류 해제
     */
    public void markPaid(LocalDateTime now) {
        transitionTo(OrderStatus.PAID, now);
        this.holdExpiresAt = null;
    }

    public void cancel(LocalDateTime now) {
        transitionTo(OrderStatus.CANCELLED, now);
    }

    public void markRefunded(LocalDateTime now) {
        transitionTo(OrderStatus.REFUNDED, now);
    }

    public void markPartiallyRefunded(LocalDateTime now) {
        transitionTo(OrderStatus.PARTIALLY_REFUNDED, now);
    }

    public boolean isPending() {
        return status == OrderStatus.PENDING;
    }

    public boolean isPaid() {
        return status == OrderStatus.PAID;
    }

    public boolean isHoldActive(LocalDateTime now) {
        return status == OrderStatus.PENDING && holdExpiresAt != null && holdExpiresAt.isAfter(now);
    }

    public boolean hasVoucher() {
        return voucherCode != null;
    }
}
