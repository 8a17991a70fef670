package com.hhplus.conference.application.webhook.handler;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Stripe 이벤트 본문 읽기 도우미
 */
final class StripeObjects {

    private StripeObjects() {
    }

    /**
     * 확장(expand) 여부에 따라 문자열 id 이거나 객체로 오는 참조 필드의 id
     */
    static String idOf(JsonNode reference) {
        if (reference == null || reference.isMissingNode() || reference.isNull()) {
            return null;
        }
        if (reference.isObject()) {
            return textOrNull(reference.path("id"));
        }
        return textOrNull(reference);
    }

    static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
