package com.hhplus.conference.application.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.hhplus.conference.domain.webhook.StripeEvent;
import com.hhplus.conference.domain.webhook.StripeEventType;

/**
 * 이벤트 종류별 처리기
 *
 * processEvent 는 WebhookEventProcessor 의 트랜잭션 안에서 호출된다.
 * 예외를 던지면 트랜잭션은 롤백되고 실패가 감사 기록으로 남는다.
 */
public interface WebhookHandler {

    StripeEventType eventType();

    /**
     * @param event      저장된 이벤트 행
     * @param dataObject 이벤트 본문의 data.object
     */
    void processEvent(StripeEvent event, JsonNode dataObject);
}
