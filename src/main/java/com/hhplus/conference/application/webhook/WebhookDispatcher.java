package com.hhplus.conference.application.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hhplus.conference.domain.conference.Conference;
import com.hhplus.conference.domain.conference.ConferenceRepository;
import com.hhplus.conference.domain.webhook.EventProcessingFailure;
import com.hhplus.conference.domain.webhook.EventProcessingFailureRepository;
import com.hhplus.conference.domain.webhook.InvalidWebhookSignatureException;
import com.hhplus.conference.domain.webhook.StripeEvent;
import com.hhplus.conference.domain.webhook.StripeEventEnvelope;
import com.hhplus.conference.domain.webhook.StripeEventNotFoundException;
import com.hhplus.conference.domain.webhook.StripeEventRepository;
import com.hhplus.conference.domain.webhook.WebhookSignatureVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * WebhookDispatcher - Stripe 웹훅 수신 진입점 (Application 계층)
 *
 * 처리 순서:
 * 1. 컨퍼런스 확인 (없거나 비활성, 서명 비밀값 미설정이면 로그만 남김)
 * 2. 서명 검증 (실패 시 경고 로그)
 * 3. stripe_id 로 중복 확인 후 이벤트 행 저장 (부수효과보다 먼저)
 * 4. 종류별 핸들러를 별도 트랜잭션에서 실행
 * 5. 핸들러 예외는 실패 감사 기록으로 남기고 이벤트는 processed=false 로 둔다
 *
 * 어떤 경우에도 예외를 호출자에게 던지지 않는다.
 * Stripe 는 2xx 가 아니면 재전송하므로 응답은 항상 200 이어야 한다.
 */
@Slf4j
@Service
public class WebhookDispatcher {

    private final ConferenceRepository conferenceRepository;
    private final StripeEventRepository stripeEventRepository;
    private final EventProcessingFailureRepository failureRepository;
    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookHandlerRegistry handlerRegistry;
    private final WebhookEventProcessor eventProcessor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WebhookDispatcher(ConferenceRepository conferenceRepository,
                             StripeEventRepository stripeEventRepository,
                             EventProcessingFailureRepository failureRepository,
                             WebhookSignatureVerifier signatureVerifier,
                             WebhookHandlerRegistry handlerRegistry,
                             WebhookEventProcessor eventProcessor,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.conferenceRepository = conferenceRepository;
        this.stripeEventRepository = stripeEventRepository;
        this.failureRepository = failureRepository;
        this.signatureVerifier = signatureVerifier;
        this.handlerRegistry = handlerRegistry;
        this.eventProcessor = eventProcessor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void receive(String conferenceSlug, String payload, String signatureHeader) {
        try {
            dispatch(conferenceSlug, payload, signatureHeader);
        } catch (RuntimeException e) {
            log.error("[WebhookDispatcher] 웹훅 수신 처리 오류 - slug={}", conferenceSlug, e);
        }
    }

    private void dispatch(String conferenceSlug, String payload, String signatureHeader) {
        Optional<Conference> found = conferenceRepository.findBySlug(conferenceSlug)
                .filter(Conference::isActive);
        if (found.isEmpty()) {
            log.warn("[WebhookDispatcher] 알 수 없는 컨퍼런스 - slug={}", conferenceSlug);
            return;
        }
        Conference conference = found.get();
        if (!conference.hasWebhookSecret()) {
            log.error("[WebhookDispatcher] 웹훅 서명 비밀값 미설정 - conferenceId={}", conference.getConferenceId());
            return;
        }

        try {
            signatureVerifier.verify(payload, signatureHeader, conference.getStripeWebhookSecret());
        } catch (InvalidWebhookSignatureException e) {
            log.warn("[WebhookDispatcher] 서명 검증 실패 - conferenceId={}, secret={}, reason={}",
                    conference.getConferenceId(), conference.maskedWebhookSecret(), e.getMessage());
            return;
        }

        StripeEventEnvelope envelope;
        try {
            envelope = StripeEventEnvelope.from(objectMapper.readTree(payload));
        } catch (JsonProcessingException e) {
            log.warn("[WebhookDispatcher] 본문 파싱 실패 - conferenceId={}, reason={}",
                    conference.getConferenceId(), e.getOriginalMessage());
            return;
        }
        if (!envelope.hasId()) {
            log.warn("[WebhookDispatcher] 이벤트 id 없음 - conferenceId={}", conference.getConferenceId());
            return;
        }

        if (stripeEventRepository.existsByStripeId(envelope.getId())) {
            log.info("[WebhookDispatcher] 중복 이벤트 무시 - stripeId={}", envelope.getId());
            return;
        }

        StripeEvent event;
        try {
            event = stripeEventRepository.saveAndFlush(StripeEvent.received(
                    envelope.getId(),
                    envelope.getType(),
                    conference.getConferenceId(),
                    envelope.isLivemode(),
                    payload,
                    LocalDateTime.now(clock)));
        } catch (DataIntegrityViolationException e) {
            // 동시에 도착한 같은 이벤트가 먼저 저장됨
            log.info("[WebhookDispatcher] 중복 이벤트 무시 (동시 수신) - stripeId={}", envelope.getId());
            return;
        }
        log.info("[WebhookDispatcher] 이벤트 수신 - stripeId={}, kind={}, conferenceId={}",
                event.getStripeId(), event.getKind(), conference.getConferenceId());

        Optional<WebhookHandler> handler = handlerRegistry.find(event.getKind());
        if (handler.isEmpty()) {
            log.info("[WebhookDispatcher] 처리 대상이 아닌 이벤트 - stripeId={}, kind={}",
                    event.getStripeId(), event.getKind());
            return;
        }
        runHandler(event, handler.get());
    }

    /**
     * 운영자 재처리
     *
     * 저장된 payload 로 핸들러를 다시 실행한다. 이미 처리된 이벤트는 아무것도 하지 않는다.
     *
     * @return 이번 호출에서 처리에 성공했으면 true
     * @throws StripeEventNotFoundException 저장된 이벤트가 없는 경우
     */
    public boolean replay(String stripeId) {
        StripeEvent event = stripeEventRepository.findByStripeId(stripeId)
                .orElseThrow(() -> new StripeEventNotFoundException(stripeId));
        if (event.isProcessed()) {
            log.info("[WebhookDispatcher] 이미 처리된 이벤트 - stripeId={}", stripeId);
            return false;
        }
        Optional<WebhookHandler> handler = handlerRegistry.find(event.getKind());
        if (handler.isEmpty()) {
            log.warn("[WebhookDispatcher] 재처리할 핸들러 없음 - stripeId={}, kind={}", stripeId, event.getKind());
            return false;
        }
        log.info("[WebhookDispatcher] 이벤트 재처리 - stripeId={}, kind={}", stripeId, event.getKind());
        return runHandler(event, handler.get());
    }

    private boolean runHandler(StripeEvent event, WebhookHandler handler) {
        try {
            return eventProcessor.process(event.getEventId(), handler);
        } catch (Exception e) {
            log.error("[WebhookDispatcher] 이벤트 처리 실패 - stripeId={}, kind={}, error={}",
                    event.getStripeId(), event.getKind(), e.getMessage(), e);
            recordFailure(event, e);
            return false;
        }
    }

    private void recordFailure(StripeEvent event, Exception cause) {
        try {
            failureRepository.save(EventProcessingFailure.of(
                    event, cause.toString(), stackTraceOf(cause), LocalDateTime.now(clock)));
        } catch (RuntimeException e) {
            log.error("[WebhookDispatcher] 실패 기록 저장 실패 - stripeId={}", event.getStripeId(), e);
        }
    }

    private static String stackTraceOf(Throwable throwable) {
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
