package com.hhplus.conference.infrastructure.persistence.cart;

import com.hhplus.conference.domain.cart.Cart;
import com.hhplus.conference.domain.cart.CartItem;
import com.hhplus.conference.domain.cart.CartRepository;
import com.hhplus.conference.domain.cart.CartStatus;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Cart Repository 구현
 *
 * Port(CartRepository) 하나로 Cart 와 CartItem 두 JpaRepository 를 감싼다.
 */
@Repository
public class MySQLCartRepository implements CartRepository {

    private final CartJpaRepository cartJpaRepository;
    private final CartItemJpaRepository cartItemJpaRepository;

    public MySQLCartRepository(CartJpaRepository cartJpaRepository,
                               CartItemJpaRepository cartItemJpaRepository) {
        this.cartJpaRepository = cartJpaRepository;
        this.cartItemJpaRepository = cartItemJpaRepository;
    }

    @Override
    public Optional<Cart> findById(Long cartId) {
        return cartJpaRepository.findById(cartId);
    }

    @Override
    public Optional<Cart> findByIdForUpdate(Long cartId) {
        return cartJpaRepository.findByIdWithLock(cartId);
    }

    @Override
    public List<Cart> findOpenCarts(Long userId, Long conferenceId) {
        return cartJpaRepository.findByUserIdAndConferenceIdAndStatusOrderByCreatedAtDescCartIdDesc(
                userId, conferenceId, CartStatus.OPEN);
    }

    @Override
    public Cart save(Cart cart) {
        return cartJpaRepository.save(cart);
    }

    @Override
    public int expireOpenCartsBefore(LocalDateTime now) {
        return cartJpaRepository.expireOpenCarts(CartStatus.OPEN, CartStatus.EXPIRED, now);
    }

    @Override
    public List<CartItem> findItems(Long cartId) {
        return cartItemJpaRepository.findByCartIdOrderByCartItemIdAsc(cartId);
    }

    @Override
    public Optional<CartItem> findItemById(Long cartItemId) {
        return cartItemJpaRepository.findById(cartItemId);
    }

    @Override
    public Optional<CartItem> findTicketItemForUpdate(Long cartId, Long ticketTypeId) {
        return cartItemJpaRepository.findTicketItemWithLock(cartId, ticketTypeId);
    }

    @Override
    public Optional<CartItem> findAddOnItemForUpdate(Long cartId, Long addOnId) {
        return cartItemJpaRepository.findAddOnItemWithLock(cartId, addOnId);
    }

    @Override
    public CartItem saveItem(CartItem cartItem) {
        return cartItemJpaRepository.saveAndFlush(cartItem);
    }

    @Override
    public void deleteItem(CartItem cartItem) {
        cartItemJpaRepository.delete(cartItem);
    }
}
