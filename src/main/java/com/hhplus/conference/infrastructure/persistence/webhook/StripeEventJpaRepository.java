package com.hhplus.conference.infrastructure.persistence.webhook;

import com.hhplus.conference.domain.webhook.StripeEvent;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface StripeEventJpaRepository extends JpaRepository<StripeEvent, Long> {

    boolean existsByStripeId(String stripeId);

    Optional<StripeEvent> findByStripeId(String stripeId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM StripeEvent e WHERE e.eventId = :eventId")
    Optional<StripeEvent> findByIdWithLock(@Param("eventId") Long eventId);
}
