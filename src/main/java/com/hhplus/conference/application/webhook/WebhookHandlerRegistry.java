package com.hhplus.conference.application.webhook;

import com.hhplus.conference.domain.webhook.StripeEventType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 이벤트 종류 → 핸들러 매핑
 */
@Component
public class WebhookHandlerRegistry {

    private final Map<StripeEventType, WebhookHandler> handlers = new EnumMap<>(StripeEventType.class);

    public WebhookHandlerRegistry(List<WebhookHandler> handlers) {
        for (WebhookHandler handler : handlers) {
            WebhookHandler previous = this.handlers.put(handler.eventType(), handler);
            if (previous != null) {
                throw new IllegalStateException("중복 웹훅 핸들러 - eventType=" + handler.eventType());
            }
        }
    }

    public Optional<WebhookHandler> find(String kind) {
        return StripeEventType.fromValue(kind).map(handlers::get);
    }
}
