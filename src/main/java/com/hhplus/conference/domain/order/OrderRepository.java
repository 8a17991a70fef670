package com.hhplus.conference.domain.order;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Order Repository Interface (Domain Layer - Port)
 *
 * 재고 집계 쿼리의 "확정 수량" 정의:
 * PAID / PARTIALLY_REFUNDED 주문 + hold_expires_at 이 now 이후인 PENDING 주문의 라인 수량 합
 */
public interface OrderRepository {

    Order save(Order order);

    Optional<Order> findById(Long orderId);

    /**
     * 상태 전환용 비관적 락 조회
     */
    Optional<Order> findByIdForUpdate(Long orderId);

    boolean existsByReference(String reference);

    Optional<Order> findByReference(String reference);

    long sumCommittedTicketQuantity(Long ticketTypeId, LocalDateTime now);

    long sumCommittedAddOnQuantity(Long addOnId, LocalDateTime now);

    /**
     * 컨퍼런스 전체 티켓 확정 수량 (애드온 제외)
     */
    long sumCommittedConferenceTicketQuantity(Long conferenceId, LocalDateTime now);

    /**
     * 사용자가 이미 구매한 (PAID / PARTIALLY_REFUNDED) 티켓 수량
     */
    long sumPurchasedTicketQuantityByUser(Long userId, Long ticketTypeId);
}
