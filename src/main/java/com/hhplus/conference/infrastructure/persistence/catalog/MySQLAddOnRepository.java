package com.hhplus.conference.infrastructure.persistence.catalog;

import com.hhplus.conference.domain.catalog.AddOn;
import com.hhplus.conference.domain.catalog.AddOnRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class MySQLAddOnRepository implements AddOnRepository {

    private final AddOnJpaRepository addOnJpaRepository;

    public MySQLAddOnRepository(AddOnJpaRepository addOnJpaRepository) {
        this.addOnJpaRepository = addOnJpaRepository;
    }

    @Override
    public Optional<AddOn> findById(Long addOnId) {
        return addOnJpaRepository.findById(addOnId);
    }

    @Override
    public Optional<AddOn> findByIdForUpdate(Long addOnId) {
        return addOnJpaRepository.findByIdWithLock(addOnId);
    }

    @Override
    public AddOn save(AddOn addOn) {
        return addOnJpaRepository.save(addOn);
    }
}
