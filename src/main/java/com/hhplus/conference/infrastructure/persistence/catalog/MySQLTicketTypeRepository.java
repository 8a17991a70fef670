package com.hhplus.conference.infrastructure.persistence.catalog;

import com.hhplus.conference.domain.catalog.TicketType;
import com.hhplus.conference.domain.catalog.TicketTypeRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class MySQLTicketTypeRepository implements TicketTypeRepository {

    private final TicketTypeJpaRepository ticketTypeJpaRepository;

    public MySQLTicketTypeRepository(TicketTypeJpaRepository ticketTypeJpaRepository) {
        this.ticketTypeJpaRepository = ticketTypeJpaRepository;
    }

    @Override
    public Optional<TicketType> findById(Long ticketTypeId) {
        return ticketTypeJpaRepository.findById(ticketTypeId);
    }

    @Override
    public Optional<TicketType> findByIdForUpdate(Long ticketTypeId) {
        return ticketTypeJpaRepository.findByIdWithLock(ticketTypeId);
    }

    @Override
    public TicketType save(TicketType ticketType) {
        return ticketTypeJpaRepository.save(ticketType);
    }
}
