package com.hhplus.conference.domain.webhook;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * StripeEvent - 결제 대행사 이벤트 중복 제거 원장
 *
 * 역할:
 * - 이벤트 id 당 한 행 (stripe_id 유니크), 부수효과보다 먼저 저장된다
 * - processed 플래그는 처리 성공 시 정확히 한 번 true 로 바뀐다
 * - 원본 payload 를 보관하여 운영자 재처리(replay)에 사용
 */
@Entity
@Table(name = "stripe_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_stripe_event_id", columnNames = "stripe_id"),
        indexes = {
                @Index(name = "idx_stripe_event_kind", columnList = "kind"),
                @Index(name = "idx_stripe_event_processed", columnList = "processed")
        })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StripeEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "event_id")
    private Long eventId;

    @Column(name = "stripe_id", nullable = false, length = 255)
    private String stripeId;

    @Column(name = "kind", nullable = false, length = 100)
    private String kind;

    @Column(name = "conference_id")
    private Long conferenceId;

    @Column(name = "livemode", nullable = false)
    private boolean livemode;

    @Lob
    @Column(name = "payload", nullable = false, columnDefinition = "LONGTEXT")
    private String payload;

    @Column(name = "processed", nullable = false)
    private boolean processed;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    public static StripeEvent received(String stripeId, String kind, Long conferenceId, boolean livemode,
                                       String payload, LocalDateTime now) {
        return StripeEvent.builder()
                .stripeId(stripeId)
                .kind(kind)
                .conferenceId(conferenceId)
                .livemode(livemode)
                .payload(payload)
                .processed(false)
                .createdAt(now)
                .build();
    }

    public void markProcessed(LocalDateTime now) {
        this.processed = true;
        this.processedAt = now;
    }
}
