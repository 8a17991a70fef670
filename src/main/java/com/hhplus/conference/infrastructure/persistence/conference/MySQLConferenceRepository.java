package com.hhplus.conference.infrastructure.persistence.conference;

import com.hhplus.conference.domain.conference.Conference;
import com.hhplus.conference.domain.conference.ConferenceRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 Conference Repository 구현
 */
@Repository
public class MySQLConferenceRepository implements ConferenceRepository {

    private final ConferenceJpaRepository conferenceJpaRepository;

    public MySQLConferenceRepository(ConferenceJpaRepository conferenceJpaRepository) {
        this.conferenceJpaRepository = conferenceJpaRepository;
    }

    @Override
    public Optional<Conference> findById(Long conferenceId) {
        return conferenceJpaRepository.findById(conferenceId);
    }

    @Override
    public Optional<Conference> findBySlug(String slug) {
        return conferenceJpaRepository.findBySlug(slug);
    }

    @Override
    public Optional<Conference> findByIdForUpdate(Long conferenceId) {
        return conferenceJpaRepository.findByIdWithLock(conferenceId);
    }

    @Override
    public Conference save(Conference conference) {
        return conferenceJpaRepository.save(conference);
    }
}
