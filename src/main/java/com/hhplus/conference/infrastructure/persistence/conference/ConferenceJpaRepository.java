package com.hhplus.conference.infrastructure.persistence.conference;

import com.hhplus.conference.domain.conference.Conference;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Conference JPA Repository
 */
public interface ConferenceJpaRepository extends JpaRepository<Conference, Long> {

    Optional<Conference> findBySlug(String slug);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Conference c WHERE c.conferenceId = :conferenceId")
    Optional<Conference> findByIdWithLock(@Param("conferenceId") Long conferenceId);
}
