package com.hhplus.conference.domain.credit;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Credit - 환불 등으로 발급된 스토어 크레딧
 *
 * 발급은 외부 환불 워크플로우가 담당하고, 코어는 applyCredit 에서 소비만 한다.
 * AVAILABLE → APPLIED (주문에 적용), 주문 취소 시 APPLIED → AVAILABLE 로 되돌린다.
 */
@Entity
@Table(name = "credits",
        indexes = @Index(name = "idx_credit_user_conference", columnList = "user_id, conference_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Credit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "credit_id")
    private Long creditId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "conference_id", nullable = false)
    private Long conferenceId;

    @Column(name = "amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private CreditStatus status;

    @Column(name = "applied_to_order_id")
    private Long appliedToOrderId;

    @Column(name = "source_order_id")
    private Long sourceOrderId;

    @Column(name = "note", columnDefinition = "TEXT")
    private String note;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isAvailable() {
        return status == CreditStatus.AVAILABLE;
    }

    public boolean belongsTo(Long userId, Long conferenceId) {
        return this.userId.equals(userId) && this.conferenceId.equals(conferenceId);
    }

    public void applyTo(Long orderId, LocalDateTime now) {
        this.status = CreditStatus.APPLIED;
        this.appliedToOrderId = orderId;
        this.updatedAt = now;
    }

    /**
     * 취소된 주문에 쓰인 크레딧을 다시 사용 가능 상태로 복구
     */
    public void restore(LocalDateTime now) {
        this.status = CreditStatus.AVAILABLE;
        this.appliedToOrderId = null;
        this.updatedAt = now;
    }
}
