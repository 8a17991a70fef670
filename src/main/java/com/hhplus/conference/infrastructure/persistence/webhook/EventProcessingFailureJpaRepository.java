package com.hhplus.conference.infrastructure.persistence.webhook;

import com.hhplus.conference.domain.webhook.EventProcessingFailure;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface EventProcessingFailureJpaRepository extends JpaRepository<EventProcessingFailure, Long> {

    List<EventProcessingFailure> findByEventIdOrderByCreatedAtAsc(Long eventId);
}
