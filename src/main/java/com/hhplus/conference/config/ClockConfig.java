package com.hhplus.conference.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * ClockConfig - 현재 시각 공급자
 *
 * 장바구니 만료, 재고 보류, 바우처 유효 기간은 모두 이 Clock 기준으로 판단한다.
 * 테스트에서는 Clock.fixed 로 교체한다.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
