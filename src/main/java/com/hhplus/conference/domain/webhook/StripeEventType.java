package com.hhplus.conference.domain.webhook;

import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * 처리 대상 Stripe 이벤트 종류
 *
 * 여기 없는 종류는 저장만 하고 처리하지 않는다 (processed=false 로 남음).
 */
@Getter
public enum StripeEventType {
    PAYMENT_INTENT_SUCCEEDED("payment_intent.succeeded"),
    PAYMENT_INTENT_PAYMENT_FAILED("payment_intent.payment_failed"),
    CHARGE_REFUNDED("charge.refunded"),
    CHARGE_DISPUTE_CREATED("charge.dispute.created");

    private final String value;

    StripeEventType(String value) {
        this.value = value;
    }

    public static Optional<StripeEventType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }
}
