package com.hhplus.conference.domain.conference;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Conference - 등록 코어가 참조하는 컨퍼런스 읽기 모델
 *
 * 역할:
 * - 웹훅 라우팅용 slug와 Stripe 비밀값 보관
 * - 컨퍼런스 전체 정원(totalCapacity) 제공 (0 = 무제한)
 *
 * 동시성 제어:
 * - 전체 정원 검증 시 이 행을 먼저 FOR UPDATE로 잠가 같은 컨퍼런스의 체크아웃을 직렬화한다
 */
@Entity
@Table(name = "conferences",
        uniqueConstraints = @UniqueConstraint(name = "uk_conference_slug", columnNames = "slug"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conference {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "conference_id")
    private Long conferenceId;

    @Column(name = "slug", nullable = false, length = 100)
    private String slug;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "total_capacity", nullable = false)
    private int totalCapacity;

    @Column(name = "stripe_secret_key", length = 200)
    private String stripeSecretKey;

    @Column(name = "stripe_webhook_secret", length = 200)
    private String stripeWebhookSecret;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public boolean hasGlobalCapacity() {
        return totalCapacity > 0;
    }

    public boolean hasWebhookSecret() {
        return stripeWebhookSecret != null && !stripeWebhookSecret.isBlank();
    }

    public String maskedWebhookSecret() {
        return mask(stripeWebhookSecret);
    }

    public String maskedSecretKey() {
        return mask(stripeSecretKey);
    }

    /**
     * 로그용 비밀값 마스킹 ("****" + 마지막 4자리)
     */
    static String mask(String secret) {
        if (secret == null || secret.isBlank()) {
            return "(none)";
        }
        if (secret.length() <= 4) {
            return "****";
        }
        return "****" + secret.substring(secret.length() - 4);
    }
}
