package com.hhplus.conference.application.checkout;

import com.hhplus.conference.common.exception.ApplicationException;
import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.config.RegistrationProperties;
import com.hhplus.conference.domain.order.OrderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * 주문 번호 생성기: {prefix}-{대문자/숫자 8자리}
 *
 * 충돌 시 다시 뽑는다. 조회와 저장 사이의 경쟁은 reference 유니크 제약이 잡는다.
 */
@Slf4j
@Component
public class OrderReferenceGenerator {

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final int SUFFIX_LENGTH = 8;
    static final int MAX_ATTEMPTS = 10;

    private final OrderRepository orderRepository;
    private final RegistrationProperties properties;
    private final SecureRandom random = new SecureRandom();

    public OrderReferenceGenerator(OrderRepository orderRepository, RegistrationProperties properties) {
        this.orderRepository = orderRepository;
        this.properties = properties;
    }

    public String generate() {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String candidate = properties.getOrderReferencePrefix() + "-" + randomSuffix();
            if (!orderRepository.existsByReference(candidate)) {
                return candidate;
            }
            log.warn("[OrderReferenceGenerator] 주문 번호 충돌 - reference={}, attempt={}", candidate, attempt);
        }
        throw new ApplicationException(ErrorCode.ORDER_REFERENCE_GENERATION_FAILED, "attempts=" + MAX_ATTEMPTS);
    }

    private String randomSuffix() {
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return suffix.toString();
    }
}
