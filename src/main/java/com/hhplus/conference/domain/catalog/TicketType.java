package com.hhplus.conference.domain.catalog;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * TicketType - 판매 티켓 유형 (운영자가 관리, 코어는 읽기 전용)
 *
 * 비즈니스 규칙:
 * - totalQuantity == 0 이면 수량 무제한
 * - limitPerUser: 장바구니 + 결제 완료 주문 합산 1인 한도
 * - requiresVoucher: 숨김 티켓을 여는 바우처가 장바구니에 있어야 담을 수 있음
 */
@Entity
@Table(name = "ticket_types",
        indexes = @Index(name = "idx_ticket_type_conference", columnList = "conference_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketType implements PurchasableItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "ticket_type_id")
    private Long id;

    @Column(name = "conference_id", nullable = false)
    private Long conferenceId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "total_quantity", nullable = false)
    private int totalQuantity;

    @Column(name = "limit_per_user", nullable = false)
    @Builder.Default
    private int limitPerUser = 10;

    @Column(name = "requires_voucher", nullable = false)
    private boolean requiresVoucher;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "available_from")
    private LocalDateTime availableFrom;

    @Column(name = "available_until")
    private LocalDateTime availableUntil;
}
