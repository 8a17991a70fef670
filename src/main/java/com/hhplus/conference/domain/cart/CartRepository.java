package com.hhplus.conference.domain.cart;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Cart Repository Interface (Domain Layer - Port)
 * 장바구니와 장바구니 항목을 함께 다룬다.
 */
public interface CartRepository {

    Optional<Cart> findById(Long cartId);

    /**
     * 변경 작업용 비관적 락 조회
     */
    Optional<Cart> findByIdForUpdate(Long cartId);

    /**
     * 사용자의 OPEN 장바구니 (최신순)
     */
    List<Cart> findOpenCarts(Long userId, Long conferenceId);

    Cart save(Cart cart);

    /**
     * 만료 시각이 지난 OPEN 장바구니를 EXPIRED로 일괄 변경
     *
     * @return 변경된 장바구니 수
     */
    int expireOpenCartsBefore(LocalDateTime now);

    List<CartItem> findItems(Long cartId);

    Optional<CartItem> findItemById(Long cartItemId);

    Optional<CartItem> findTicketItemForUpdate(Long cartId, Long ticketTypeId);

    Optional<CartItem> findAddOnItemForUpdate(Long cartId, Long addOnId);

    /**
     * 즉시 flush하여 유니크 제약 위반을 호출 지점에서 드러낸다
     */
    CartItem saveItem(CartItem cartItem);

    void deleteItem(CartItem cartItem);
}
