package com.hhplus.conference.infrastructure.config;

import com.hhplus.conference.domain.pricing.DiscountCalculator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * DomainServiceConfig - 순수 도메인 서비스를 Spring Bean 으로 등록
 *
 * 도메인 서비스는 외부 의존성이 없으므로 프레임워크 어노테이션 없이 작성하고 여기서만 등록한다.
 */
@Configuration
public class DomainServiceConfig {

    @Bean
    public DiscountCalculator discountCalculator() {
        return new DiscountCalculator();
    }
}
