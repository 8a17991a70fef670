package com.hhplus.conference.infrastructure.persistence.credit;

import com.hhplus.conference.domain.credit.Credit;
import com.hhplus.conference.domain.credit.CreditRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class MySQLCreditRepository implements CreditRepository {

    private final CreditJpaRepository creditJpaRepository;

    public MySQLCreditRepository(CreditJpaRepository creditJpaRepository) {
        this.creditJpaRepository = creditJpaRepository;
    }

    @Override
    public Credit save(Credit credit) {
        return creditJpaRepository.save(credit);
    }

    @Override
    public Optional<Credit> findById(Long creditId) {
        return creditJpaRepository.findById(creditId);
    }

    @Override
    public Optional<Credit> findByIdForUpdate(Long creditId) {
        return creditJpaRepository.findByIdWithLock(creditId);
    }
}
