package com.hhplus.conference.infrastructure.persistence.catalog;

import com.hhplus.conference.domain.catalog.AddOn;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * AddOn JPA Repository
 */
public interface AddOnJpaRepository extends JpaRepository<AddOn, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AddOn a WHERE a.id = :addOnId")
    Optional<AddOn> findByIdWithLock(@Param("addOnId") Long addOnId);
}
