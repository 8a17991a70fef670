package com.hhplus.conference.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * RegistrationProperties - registration.* 설정 바인딩
 *
 * 잘못된 값(0 이하 만료 시간, 빈 통화 코드 등)은 애플리케이션 기동을 실패시킨다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "registration")
public class RegistrationProperties {

    /**
     * 장바구니 슬라이딩 만료 시간 (분)
     */
    @Positive
    private int cartExpiryMinutes = 30;

    /**
     * PENDING 주문의 재고 보류 시간 (분)
     */
    @Positive
    private int pendingOrderExpiryMinutes = 15;

    @NotBlank
    private String orderReferencePrefix = "ORD";

    @NotBlank
    private String currency = "USD";

    @Valid
    private Stripe stripe = new Stripe();

    @Valid
    private CartReaper cartReaper = new CartReaper();

    public Duration cartTtl() {
        return Duration.ofMinutes(cartExpiryMinutes);
    }

    public Duration holdDuration() {
        return Duration.ofMinutes(pendingOrderExpiryMinutes);
    }

    @Getter
    @Setter
    public static class Stripe {

        /**
         * 서명 타임스탬프 허용 오차 (초)
         */
        @Positive
        private long webhookToleranceSeconds = 300;
    }

    @Getter
    @Setter
    public static class CartReaper {

        @Positive
        private long fixedDelayMs = 60000;
    }
}
