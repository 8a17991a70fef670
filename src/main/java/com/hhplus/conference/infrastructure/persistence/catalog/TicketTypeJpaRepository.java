package com.hhplus.conference.infrastructure.persistence.catalog;

import com.hhplus.conference.domain.catalog.TicketType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * TicketType JPA Repository
 */
public interface TicketTypeJpaRepository extends JpaRepository<TicketType, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TicketType t WHERE t.id = :ticketTypeId")
    Optional<TicketType> findByIdWithLock(@Param("ticketTypeId") Long ticketTypeId);
}
