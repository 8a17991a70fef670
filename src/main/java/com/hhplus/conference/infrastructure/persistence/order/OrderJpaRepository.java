package com.hhplus.conference.infrastructure.persistence.order;

import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

/**
 * Order JPA Repository
 *
 * 확정 수량 조건: status IN (:committed) OR (status = :pending AND hold_expires_at > :now)
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithLock(@Param("orderId") Long orderId);

    boolean existsByReference(String reference);

    Optional<Order> findByReference(String reference);

    @Query("SELECT COALESCE(SUM(li.quantity), 0L) FROM Order o JOIN o.lineItems li " +
            "WHERE li.ticketTypeId = :ticketTypeId " +
            "AND (o.status IN :committed OR (o.status = :pending AND o.holdExpiresAt > :now))")
    Long sumCommittedTicketQuantity(@Param("ticketTypeId") Long ticketTypeId,
                                    @Param("committed") Collection<OrderStatus> committed,
                                    @Param("pending") OrderStatus pending,
                                    @Param("now") LocalDateTime now);

    @Query("SELECT COALESCE(SUM(li.quantity), 0L) FROM Order o JOIN o.lineItems li " +
            "WHERE li.addOnId = :addOnId " +
            "AND (o.status IN :committed OR (o.status = :pending AND o.holdExpiresAt > :now))")
    Long sumCommittedAddOnQuantity(@Param("addOnId") Long addOnId,
                                   @Param("committed") Collection<OrderStatus> committed,
                                   @Param("pending") OrderStatus pending,
                                   @Param("now") LocalDateTime now);

    @Query("SELECT COALESCE(SUM(li.quantity), 0L) FROM Order o JOIN o.lineItems li " +
            "WHERE o.conferenceId = :conferenceId AND li.ticketTypeId IS NOT NULL " +
            "AND (o.status IN :committed OR (o.status = :pending AND o.holdExpiresAt > :now))")
    Long sumCommittedConferenceTicketQuantity(@Param("conferenceId") Long conferenceId,
                                              @Param("committed") Collection<OrderStatus> committed,
                                              @Param("pending") OrderStatus pending,
                                              @Param("now") LocalDateTime now);

    @Query("SELECT COALESCE(SUM(li.quantity), 0L) FROM Order o JOIN o.lineItems li " +
            "WHERE o.userId = :userId AND li.ticketTypeId = :ticketTypeId AND o.status IN :committed")
    Long sumPurchasedTicketQuantityByUser(@Param("userId") Long userId,
                                          @Param("ticketTypeId") Long ticketTypeId,
                                          @Param("committed") Collection<OrderStatus> committed);
}
