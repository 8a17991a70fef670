package com.hhplus.conference.infrastructure.persistence.webhook;

import com.hhplus.conference.domain.webhook.EventProcessingFailure;
import com.hhplus.conference.domain.webhook.EventProcessingFailureRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class MySQLEventProcessingFailureRepository implements EventProcessingFailureRepository {

    private final EventProcessingFailureJpaRepository failureJpaRepository;

    public MySQLEventProcessingFailureRepository(EventProcessingFailureJpaRepository failureJpaRepository) {
        this.failureJpaRepository = failureJpaRepository;
    }

    @Override
    public EventProcessingFailure save(EventProcessingFailure failure) {
        return failureJpaRepository.save(failure);
    }

    @Override
    public List<EventProcessingFailure> findByEventId(Long eventId) {
        return failureJpaRepository.findByEventIdOrderByCreatedAtAsc(eventId);
    }
}
