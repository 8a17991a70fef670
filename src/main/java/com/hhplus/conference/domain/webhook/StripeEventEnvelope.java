package com.hhplus.conference.domain.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

/**
 * 서명 검증을 통과한 이벤트 본문의 파싱 결과
 *
 * data.object 는 이벤트 종류마다 모양이 다르므로 JsonNode 그대로 핸들러에 넘긴다.
 */
@Getter
public class StripeEventEnvelope {

    private final String id;
    private final String type;
    private final boolean livemode;
    private final JsonNode dataObject;

    private StripeEventEnvelope(String id, String type, boolean livemode, JsonNode dataObject) {
        this.id = id;
        this.type = type;
        this.livemode = livemode;
        this.dataObject = dataObject;
    }

    public static StripeEventEnvelope from(JsonNode root) {
        return new StripeEventEnvelope(
                root.path("id").asText(""),
                root.path("type").asText(""),
                root.path("livemode").asBoolean(false),
                root.path("data").path("object"));
    }

    public boolean hasId() {
        return !id.isBlank();
    }
}
