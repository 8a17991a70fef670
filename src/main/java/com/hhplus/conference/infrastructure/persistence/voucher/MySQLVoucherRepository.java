package com.hhplus.conference.infrastructure.persistence.voucher;

import com.hhplus.conference.domain.voucher.Voucher;
import com.hhplus.conference.domain.voucher.VoucherRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public class MySQLVoucherRepository implements VoucherRepository {

    private final VoucherJpaRepository voucherJpaRepository;

    public MySQLVoucherRepository(VoucherJpaRepository voucherJpaRepository) {
        this.voucherJpaRepository = voucherJpaRepository;
    }

    @Override
    public Optional<Voucher> findById(Long voucherId) {
        return voucherJpaRepository.findById(voucherId);
    }

    @Override
    public Optional<Voucher> findByIdForUpdate(Long voucherId) {
        return voucherJpaRepository.findByIdWithLock(voucherId);
    }

    @Override
    public Optional<Voucher> findByConferenceIdAndCode(Long conferenceId, String normalizedCode) {
        return voucherJpaRepository.findByConferenceIdAndCode(conferenceId, normalizedCode);
    }

    @Override
    public int incrementUsage(Long voucherId, LocalDateTime now) {
        return voucherJpaRepository.incrementTimesUsed(voucherId, now);
    }

    @Override
    public int decrementUsage(Long voucherId) {
        return voucherJpaRepository.decrementTimesUsed(voucherId);
    }

    @Override
    public Voucher save(Voucher voucher) {
        return voucherJpaRepository.save(voucher);
    }
}
