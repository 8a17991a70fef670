package com.hhplus.conference.application.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 체크아웃 요청 (청구 정보는 모두 선택)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutCommand {
    private Long userId;
    private String conferenceSlug;
    private String billingName;
    private String billingEmail;
    private String billingCompany;
}
