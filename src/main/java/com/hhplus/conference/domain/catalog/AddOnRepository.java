package com.hhplus.conference.domain.catalog;

import java.util.Optional;

/**
 * AddOn Repository Interface (Domain Layer - Port)
 */
public interface AddOnRepository {

    Optional<AddOn> findById(Long addOnId);

    Optional<AddOn> findByIdForUpdate(Long addOnId);

    AddOn save(AddOn addOn);
}
