package com.hhplus.conference.application.cart;

import com.hhplus.conference.domain.cart.CartRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 만료 시각이 지난 OPEN 장바구니를 EXPIRED 로 정리하는 주기 작업
 *
 * 정리 전이라도 만료된 장바구니는 변경 시점에 거부되므로 정합성은 이 작업에 의존하지 않는다.
 */
@Slf4j
@Component
public class CartReaper {

    private final CartRepository cartRepository;
    private final Clock clock;

    public CartReaper(CartRepository cartRepository, Clock clock) {
        this.cartRepository = cartRepository;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${registration.cart-reaper.fixed-delay-ms}")
    @Transactional
    public void expireStaleCarts() {
        int expired = cartRepository.expireOpenCartsBefore(LocalDateTime.now(clock));
        if (expired > 0) {
            log.info("[CartReaper] 만료 장바구니 정리 - count={}", expired);
        }
    }
}
