package com.hhplus.conference.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.conference.application.payment.dto.PaymentIntentResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentIntentCreatedResponse {

    @JsonProperty("order_id")
    private Long orderId;

    private String reference;

    @JsonProperty("payment_intent_id")
    private String paymentIntentId;

    @JsonProperty("client_secret")
    private String clientSecret;

    private BigDecimal amount;

    private String currency;

    public static PaymentIntentCreatedResponse from(PaymentIntentResponse response) {
        return PaymentIntentCreatedResponse.builder()
                .orderId(response.getOrderId())
                .reference(response.getReference())
                .paymentIntentId(response.getPaymentIntentId())
                .clientSecret(response.getClientSecret())
                .amount(response.getAmount())
                .currency(response.getCurrency())
                .build();
    }
}
