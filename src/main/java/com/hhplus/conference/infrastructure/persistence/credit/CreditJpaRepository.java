package com.hhplus.conference.infrastructure.persistence.credit;

import com.hhplus.conference.domain.credit.Credit;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface CreditJpaRepository extends JpaRepository<Credit, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Credit c WHERE c.creditId = :creditId")
    Optional<Credit> findByIdWithLock(@Param("creditId") Long creditId);
}
