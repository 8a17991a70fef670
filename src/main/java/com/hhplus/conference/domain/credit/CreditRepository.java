package com.hhplus.conference.domain.credit;

import java.util.Optional;

/**
 * Credit Repository Interface (Domain Layer - Port)
 */
public interface CreditRepository {

    Credit save(Credit credit);

    Optional<Credit> findById(Long creditId);

    Optional<Credit> findByIdForUpdate(Long creditId);
}
