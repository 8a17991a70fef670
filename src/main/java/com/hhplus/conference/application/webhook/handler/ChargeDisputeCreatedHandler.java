package com.hhplus.conference.application.webhook.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.hhplus.conference.application.webhook.WebhookHandler;
import com.hhplus.conference.domain.webhook.StripeEvent;
import com.hhplus.conference.domain.webhook.StripeEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * charge.dispute.created - 운영자 확인용 경고 로그만 남긴다
 */
@Slf4j
@Component
public class ChargeDisputeCreatedHandler implements WebhookHandler {

    @Override
    public StripeEventType eventType() {
        return StripeEventType.CHARGE_DISPUTE_CREATED;
    }

    @Override
    public void processEvent(StripeEvent event, JsonNode dispute) {
        log.warn("[ChargeDisputeCreatedHandler] 분쟁 접수 - disputeId={}, chargeId={}, amount={}, reason={}",
                StripeObjects.textOrNull(dispute.path("id")),
                StripeObjects.idOf(dispute.path("charge")),
                dispute.path("amount").asLong(),
                StripeObjects.textOrNull(dispute.path("reason")));
    }
}
