package com.hhplus.conference.infrastructure.persistence.order;

import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderRepository;
import com.hhplus.conference.domain.order.OrderStatus;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 */
@Repository
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
    }

    @Override
    public Order save(Order order) {
        return orderJpaRepository.saveAndFlush(order);
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findById(orderId);
    }

    @Override
    public Optional<Order> findByIdForUpdate(Long orderId) {
        return orderJpaRepository.findByIdWithLock(orderId);
    }

    @Override
    public boolean existsByReference(String reference) {
        return orderJpaRepository.existsByReference(reference);
    }

    @Override
    public Optional<Order> findByReference(String reference) {
        return orderJpaRepository.findByReference(reference);
    }

    @Override
    public long sumCommittedTicketQuantity(Long ticketTypeId, LocalDateTime now) {
        return nullToZero(orderJpaRepository.sumCommittedTicketQuantity(
                ticketTypeId, OrderStatus.INVENTORY_COMMITTED, OrderStatus.PENDING, now));
    }

    @Override
    public long sumCommittedAddOnQuantity(Long addOnId, LocalDateTime now) {
        return nullToZero(orderJpaRepository.sumCommittedAddOnQuantity(
                addOnId, OrderStatus.INVENTORY_COMMITTED, OrderStatus.PENDING, now));
    }

    @Override
    public long sumCommittedConferenceTicketQuantity(Long conferenceId, LocalDateTime now) {
        return nullToZero(orderJpaRepository.sumCommittedConferenceTicketQuantity(
                conferenceId, OrderStatus.INVENTORY_COMMITTED, OrderStatus.PENDING, now));
    }

    @Override
    public long sumPurchasedTicketQuantityByUser(Long userId, Long ticketTypeId) {
        return nullToZero(orderJpaRepository.sumPurchasedTicketQuantityByUser(
                userId, ticketTypeId, OrderStatus.INVENTORY_COMMITTED));
    }

    private long nullToZero(Long value) {
        return value == null ? 0L : value;
    }
}
