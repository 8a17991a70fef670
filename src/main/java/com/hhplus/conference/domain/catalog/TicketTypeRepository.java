package com.hhplus.conference.domain.catalog;

import java.util.Optional;

/**
 * TicketType Repository Interface (Domain Layer - Port)
 */
public interface TicketTypeRepository {

    Optional<TicketType> findById(Long ticketTypeId);

    /**
     * 재고 검증용 비관적 락 조회 (같은 티켓 유형의 동시 체크아웃 직렬화)
     */
    Optional<TicketType> findByIdForUpdate(Long ticketTypeId);

    TicketType save(TicketType ticketType);
}
