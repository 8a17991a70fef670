package com.hhplus.conference.application.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hhplus.conference.domain.webhook.StripeEvent;
import com.hhplus.conference.domain.webhook.StripeEventNotFoundException;
import com.hhplus.conference.domain.webhook.StripeEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * WebhookEventProcessor - 이벤트 한 건의 트랜잭션 처리
 *
 * 이벤트 행을 잠근 뒤 processed 를 다시 확인하므로 같은 이벤트가 동시에 재전송돼도 부수효과는 한 번만 일어난다.
 * 핸들러의 부수효과와 processed=true 는 같은 트랜잭션에서 커밋된다.
 */
@Slf4j
@Service
public class WebhookEventProcessor {

    private final StripeEventRepository stripeEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WebhookEventProcessor(StripeEventRepository stripeEventRepository,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.stripeEventRepository = stripeEventRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @return 이번 호출에서 처리했으면 true, 이미 처리된 이벤트면 false
     */
    @Transactional
    public boolean process(Long eventId, WebhookHandler handler) {
        StripeEvent event = stripeEventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> new StripeEventNotFoundException("eventId=" + eventId));
        if (event.isProcessed()) {
            log.info("[WebhookEventProcessor] 이미 처리된 이벤트 - stripeId={}", event.getStripeId());
            return false;
        }

        handler.processEvent(event, readDataObject(event));

        event.markProcessed(LocalDateTime.now(clock));
        stripeEventRepository.saveAndFlush(event);
        log.info("[WebhookEventProcessor] 이벤트 처리 완료 - stripeId={}, kind={}", event.getStripeId(), event.getKind());
        return true;
    }

    private JsonNode readDataObject(StripeEvent event) {
        try {
            return objectMapper.readTree(event.getPayload()).path("data").path("object");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("저장된 payload 파싱 실패 - stripeId=" + event.getStripeId(), e);
        }
    }
}
