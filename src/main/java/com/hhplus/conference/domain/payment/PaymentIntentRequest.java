package com.hhplus.conference.domain.payment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 결제 의도 생성 요청
 *
 * amountMinorUnits 는 통화의 최소 단위 (USD 면 센트, JPY 면 엔)
 */
@Getter
@Builder
@AllArgsConstructor
public class PaymentIntentRequest {
    private final String secretKey;
    private final long amountMinorUnits;
    private final String currency;
    private final Long orderId;
    private final String reference;
    private final String receiptEmail;
}
