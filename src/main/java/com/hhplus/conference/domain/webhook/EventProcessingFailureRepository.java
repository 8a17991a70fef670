package com.hhplus.conference.domain.webhook;

import java.util.List;

/**
 * EventProcessingFailure Repository Interface (Domain Layer - Port)
 */
public interface EventProcessingFailureRepository {

    EventProcessingFailure save(EventProcessingFailure failure);

    List<EventProcessingFailure> findByEventId(Long eventId);
}
