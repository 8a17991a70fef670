package com.hhplus.conference.application.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 결제 시작 결과 (Application layer 내부 DTO)
 *
 * clientSecret 은 브라우저에서 결제를 확정할 때만 쓰인다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentIntentResponse {
    private Long orderId;
    private String reference;
    private String paymentIntentId;
    private String clientSecret;
    private BigDecimal amount;
    private String currency;
}
