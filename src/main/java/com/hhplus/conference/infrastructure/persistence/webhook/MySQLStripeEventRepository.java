package com.hhplus.conference.infrastructure.persistence.webhook;

import com.hhplus.conference.domain.webhook.StripeEvent;
import com.hhplus.conference.domain.webhook.StripeEventRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class MySQLStripeEventRepository implements StripeEventRepository {

    private final StripeEventJpaRepository stripeEventJpaRepository;

    public MySQLStripeEventRepository(StripeEventJpaRepository stripeEventJpaRepository) {
        this.stripeEventJpaRepository = stripeEventJpaRepository;
    }

    @Override
    public boolean existsByStripeId(String stripeId) {
        return stripeEventJpaRepository.existsByStripeId(stripeId);
    }

    @Override
    public Optional<StripeEvent> findByStripeId(String stripeId) {
        return stripeEventJpaRepository.findByStripeId(stripeId);
    }

    @Override
    public Optional<StripeEvent> findByIdForUpdate(Long eventId) {
        return stripeEventJpaRepository.findByIdWithLock(eventId);
    }

    @Override
    public StripeEvent saveAndFlush(StripeEvent event) {
        return stripeEventJpaRepository.saveAndFlush(event);
    }
}
