package com.hhplus.conference.infrastructure.persistence.voucher;

import com.hhplus.conference.domain.voucher.Voucher;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Voucher JPA Repository
 *
 * 사용 횟수 변경은 읽고-쓰기 대신 조건부 단일 UPDATE 로만 수행한다.
 */
public interface VoucherJpaRepository extends JpaRepository<Voucher, Long> {

    Optional<Voucher> findByConferenceIdAndCode(Long conferenceId, String code);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM Voucher v WHERE v.voucherId = :voucherId")
    Optional<Voucher> findByIdWithLock(@Param("voucherId") Long voucherId);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Voucher v SET v.timesUsed = v.timesUsed + 1 " +
            "WHERE v.voucherId = :voucherId AND v.active = true AND v.timesUsed < v.maxUses " +
            "AND (v.validFrom IS NULL OR v.validFrom <= :now) " +
            "AND (v.validUntil IS NULL OR v.validUntil >= :now)")
    int incrementTimesUsed(@Param("voucherId") Long voucherId, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Voucher v SET v.timesUsed = v.timesUsed - 1 WHERE v.voucherId = :voucherId AND v.timesUsed > 0")
    int decrementTimesUsed(@Param("voucherId") Long voucherId);
}
