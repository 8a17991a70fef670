package com.hhplus.conference.infrastructure.persistence.cart;

import com.hhplus.conference.domain.cart.CartItem;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * CartItem JPA Repository
 */
public interface CartItemJpaRepository extends JpaRepository<CartItem, Long> {

    List<CartItem> findByCartIdOrderByCartItemIdAsc(Long cartId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM CartItem i WHERE i.cartId = :cartId AND i.ticketTypeId = :ticketTypeId")
    Optional<CartItem> findTicketItemWithLock(@Param("cartId") Long cartId,
                                              @Param("ticketTypeId") Long ticketTypeId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM CartItem i WHERE i.cartId = :cartId AND i.addOnId = :addOnId")
    Optional<CartItem> findAddOnItemWithLock(@Param("cartId") Long cartId,
                                             @Param("addOnId") Long addOnId);
}
