package com.hhplus.conference.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Cart - 사용자별, 컨퍼런스별 구매 전 장바구니
 *
 * 비즈니스 규칙:
 * - (사용자, 컨퍼런스)당 OPEN 장바구니는 하나
 * - 변경이 일어날 때마다 만료 시각을 now + TTL로 연장 (슬라이딩 윈도우)
 * - 만료 시각이 지났으면 정리 작업 전이라도 열려 있지 않은 것으로 취급
 */
@Entity
@Table(name = "carts",
        indexes = @Index(name = "idx_cart_user_conference_status",
                columnList = "user_id, conference_id, status"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Cart {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_id")
    private Long cartId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "conference_id", nullable = false)
    private Long conferenceId;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private CartStatus status;

    @Column(name = "voucher_id")
    private Long voucherId;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Cart open(Long userId, Long conferenceId, LocalDateTime now, Duration ttl) {
        return Cart.builder()
                .userId(userId)
                .conferenceId(conferenceId)
                .status(CartStatus.OPEN)
                .expiresAt(now.plus(ttl))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isOpen(LocalDateTime now) {
        return status == CartStatus.OPEN && !isExpired(now);
    }

    /**
     * 변경 작업 전 검증
     *
     * @throws CartNotOpenException OPEN 상태가 아니거나 이미 만료된 경우
     */
    public void assertOpen(LocalDateTime now) {
        if (!isOpen(now)) {
            throw new CartNotOpenException(cartId, status);
        }
    }

    public void extendExpiry(LocalDateTime now, Duration ttl) {
        this.expiresAt = now.plus(ttl);
        this.updatedAt = now;
    }

    public void attachVoucher(Long voucherId, LocalDateTime now) {
        this.voucherId = voucherId;
        this.updatedAt = now;
    }

    public boolean hasVoucher() {
        return voucherId != null;
    }

    public void expire(LocalDateTime now) {
        this.status = CartStatus.EXPIRED;
        this.updatedAt = now;
    }

    public void markCheckedOut(LocalDateTime now) {
        this.status = CartStatus.CHECKED_OUT;
        this.updatedAt = now;
    }
}
