package com.hhplus.conference.domain.voucher;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Voucher Repository Interface (Domain Layer - Port)
 */
public interface VoucherRepository {

    Optional<Voucher> findById(Long voucherId);

    /**
     * 체크아웃 재검증용 비관적 락 조회
     */
    Optional<Voucher> findByIdForUpdate(Long voucherId);

    /**
     * 대문자로 정규화된 코드로 조회
     */
    Optional<Voucher> findByConferenceIdAndCode(Long conferenceId, String normalizedCode);

    /**
     * 사용 횟수 원자적 증가
     *
     * UPDATE … SET times_used = times_used + 1 WHERE 활성, 잔여 횟수, 유효 기간
     *
     * @return 갱신된 행 수 (0이면 더 이상 사용할 수 없는 바우처)
     */
    int incrementUsage(Long voucherId, LocalDateTime now);

    /**
     * 사용 횟수 원자적 감소 (0 미만으로 내려가지 않음)
     */
    int decrementUsage(Long voucherId);

    Voucher save(Voucher voucher);
}
