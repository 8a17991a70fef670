package com.hhplus.conference;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 컨퍼런스 등록 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableAsync: 주문 결제 완료 알림의 커밋 후 비동기 발행
 * - @EnableRetry: 동시 삽입 충돌, 주문 번호 충돌 1회 재시도
 * - @EnableScheduling: 만료 장바구니 정리
 * - @EnableAspectJAutoProxy: AOP Aspect 자동 프록시 생성
 */
@EnableAsync
@EnableRetry
@EnableScheduling
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@SpringBootApplication
public class ConferenceRegistrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConferenceRegistrationApplication.class, args);
    }

}
