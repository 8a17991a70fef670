package com.hhplus.conference.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * CartItem - 장바구니 한 줄
 *
 * 비즈니스 규칙:
 * - ticketTypeId / addOnId 중 정확히 하나만 값이 있어야 함 (저장 시점에 검증)
 * - (cart_id, ticket_type_id), (cart_id, addon_id) 유니크 제약으로 같은 상품은 한 줄에 누적
 */
@Entity
@Table(name = "cart_items",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_cart_item_ticket", columnNames = {"cart_id", "ticket_type_id"}),
                @UniqueConstraint(name = "uk_cart_item_addon", columnNames = {"cart_id", "addon_id"})
        })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_item_id")
    private Long cartItemId;

    @Column(name = "cart_id", nullable = false)
    private Long cartId;

    @Column(name = "ticket_type_id")
    private Long ticketTypeId;

    @Column(name = "addon_id")
    private Long addOnId;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static CartItem forTicket(Long cartId, Long ticketTypeId, int quantity, LocalDateTime now) {
        return CartItem.builder()
                .cartId(cartId)
                .ticketTypeId(ticketTypeId)
                .quantity(quantity)
                .createdAt(now)
                .build();
    }

    public static CartItem forAddOn(Long cartId, Long addOnId, int quantity, LocalDateTime now) {
        return CartItem.builder()
                .cartId(cartId)
                .addOnId(addOnId)
                .quantity(quantity)
                .createdAt(now)
                .build();
    }

    public boolean isTicket() {
        return ticketTypeId != null;
    }

    public boolean isAddOn() {
        return addOnId != null;
    }

    public void increaseQuantity(int delta) {
        this.quantity += delta;
    }

    public void changeQuantity(int quantity) {
        this.quantity = quantity;
    }

    @PrePersist
    @PreUpdate
    void validateExactlyOneReference() {
        if ((ticketTypeId == null) == (addOnId == null)) {
            throw new IllegalStateException(
                    "CartItem은 티켓 유형과 애드온 중 정확히 하나를 참조해야 합니다. cartId=" + cartId);
        }
    }
}
