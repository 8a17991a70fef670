package com.hhplus.conference.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * OrderLineItem - 체크아웃 시점의 구매 라인 스냅샷
 *
 * 생성 후 변경되지 않는다. ticketTypeId / addOnId 는 원본 상품에 대한 느슨한 참조다.
 */
@Entity
@Table(name = "order_line_items",
        indexes = {
                @Index(name = "idx_line_item_ticket_type", columnList = "ticket_type_id"),
                @Index(name = "idx_line_item_addon", columnList = "addon_id")
        })
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderLineItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "line_item_id")
    private Long lineItemId;

    @Column(name = "description", nullable = false, length = 300, updatable = false)
    private String description;

    @Column(name = "quantity", nullable = false, updatable = false)
    private int quantity;

    @Column(name = "unit_price", nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal unitPrice;

    @Column(name = "discount_amount", nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal discountAmount;

    @Column(name = "line_total", nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal lineTotal;

    @Column(name = "ticket_type_id", updatable = false)
    private Long ticketTypeId;

    @Column(name = "addon_id", updatable = false)
    private Long addOnId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 라인 스냅샷 생성
     *
     * @param lineTotal 할인 적용 후 금액 (unitPrice × quantity − discountAmount)
     */
    public static OrderLineItem snapshot(String description, int quantity, BigDecimal unitPrice,
                                         BigDecimal discountAmount, BigDecimal lineTotal,
                                         Long ticketTypeId, Long addOnId, LocalDateTime now) {
        if (quantity < 1) {
            throw new IllegalArgumentException("주문 라인 수량은 1 이상이어야 합니다: " + quantity);
        }
        return OrderLineItem.builder()
                .description(description)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .discountAmount(discountAmount)
                .lineTotal(lineTotal)
                .ticketTypeId(ticketTypeId)
                .addOnId(addOnId)
                .createdAt(now)
                .build();
    }
}
