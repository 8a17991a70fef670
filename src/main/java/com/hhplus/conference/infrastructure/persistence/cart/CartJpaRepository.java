package com.hhplus.conference.infrastructure.persistence.cart;

import com.hhplus.conference.domain.cart.Cart;
import com.hhplus.conference.domain.cart.CartStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Cart JPA Repository
 */
public interface CartJpaRepository extends JpaRepository<Cart, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Cart c WHERE c.cartId = :cartId")
    Optional<Cart> findByIdWithLock(@Param("cartId") Long cartId);

    List<Cart> findByUserIdAndConferenceIdAndStatusOrderByCreatedAtDescCartIdDesc(
            Long userId, Long conferenceId, CartStatus status);

    @Modifying
    @Query("UPDATE Cart c SET c.status = :expired, c.updatedAt = :now " +
            "WHERE c.status = :open AND c.expiresAt IS NOT NULL AND c.expiresAt <= :now")
    int expireOpenCarts(@Param("open") CartStatus open,
                        @Param("expired") CartStatus expired,
                        @Param("now") LocalDateTime now);
}
