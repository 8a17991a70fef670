package com.hhplus.conference.domain.webhook;

import java.util.Optional;

/**
 * StripeEvent Repository Interface (Domain Layer - Port)
 */
public interface StripeEventRepository {

    boolean existsByStripeId(String stripeId);

    Optional<StripeEvent> findByStripeId(String stripeId);

    /**
     * 같은 이벤트의 동시 처리를 직렬화하기 위한 비관적 락 조회
     */
    Optional<StripeEvent> findByIdForUpdate(Long eventId);

    /**
     * 즉시 flush 하여 stripe_id 유니크 제약 위반을 호출 지점에서 드러낸다
     */
    StripeEvent saveAndFlush(StripeEvent event);
}
