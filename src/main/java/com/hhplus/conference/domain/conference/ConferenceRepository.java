package com.hhplus.conference.domain.conference;

import java.util.Optional;

/**
 * Conference Repository Interface (Domain Layer - Port)
 */
public interface ConferenceRepository {

    Optional<Conference> findById(Long conferenceId);

    Optional<Conference> findBySlug(String slug);

    /**
     * 전체 정원 검증용 비관적 락 조회
     */
    Optional<Conference> findByIdForUpdate(Long conferenceId);

    Conference save(Conference conference);
}
