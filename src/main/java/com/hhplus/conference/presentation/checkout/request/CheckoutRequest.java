package com.hhplus.conference.presentation.checkout.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 체크아웃 요청 DTO (청구 정보는 모두 선택, 본문 생략 가능)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutRequest {

    @JsonProperty("billing_name")
    private String billingName;

    @JsonProperty("billing_email")
    private String billingEmail;

    @JsonProperty("billing_company")
    private String billingCompany;
}
