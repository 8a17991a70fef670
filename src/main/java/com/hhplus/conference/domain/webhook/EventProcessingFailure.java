package com.hhplus.conference.domain.webhook;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * EventProcessingFailure - 웹훅 처리 실패 감사 기록
 *
 * 역할:
 * - 핸들러 예외의 메시지와 스택 트레이스를 저장해 수동 복구에 사용
 * - 실패한 이벤트는 processed=false 로 남아 재처리 대상이 된다
 */
@Entity
@Table(name = "event_processing_failures",
        indexes = {
                @Index(name = "idx_failure_event", columnList = "event_id"),
                @Index(name = "idx_failure_created_at", columnList = "created_at")
        })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventProcessingFailure {

    public static final int MAX_MESSAGE_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "failure_id")
    private Long failureId;

    @Column(name = "event_id", nullable = false)
    private Long eventId;

    @Column(name = "stripe_id", nullable = false, length = 255)
    private String stripeId;

    @Column(name = "error_message", nullable = false, length = MAX_MESSAGE_LENGTH)
    private String errorMessage;

    @Column(name = "stack_trace", columnDefinition = "TEXT")
    private String stackTrace;

    /**
     * 실패 시점의 원본 이벤트 payload
     */
    @Lob
    @Column(name = "payload", columnDefinition = "LONGTEXT")
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static EventProcessingFailure of(StripeEvent event, String message, String stackTrace, LocalDateTime now) {
        String safeMessage = message == null ? "(no message)" : message;
        if (safeMessage.length() > MAX_MESSAGE_LENGTH) {
            safeMessage = safeMessage.substring(0, MAX_MESSAGE_LENGTH);
        }
        return EventProcessingFailure.builder()
                .eventId(event.getEventId())
                .stripeId(event.getStripeId())
                .errorMessage(safeMessage)
                .stackTrace(stackTrace)
                .payload(event.getPayload())
                .createdAt(now)
                .build();
    }
}
