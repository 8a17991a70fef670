package com.hhplus.conference.domain.payment;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PaymentIntentResult {
    private final String paymentIntentId;
    private final String clientSecret;
}
