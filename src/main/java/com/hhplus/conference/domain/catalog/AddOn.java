package com.hhplus.conference.domain.catalog;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * AddOn - 티켓에 딸린 부가 상품 (워크숍, 티셔츠 등)
 *
 * 비즈니스 규칙:
 * - requiredTicketTypeIds가 비어 있지 않으면 그중 하나 이상이 같은 장바구니에 있어야 담을 수 있음
 * - totalQuantity == 0 이면 수량 무제한, 전체 컨퍼런스 정원에는 포함되지 않음
 */
@Entity
@Table(name = "addons",
        indexes = @Index(name = "idx_addon_conference", columnList = "conference_id"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddOn implements PurchasableItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "addon_id")
    private Long id;

    @Column(name = "conference_id", nullable = false)
    private Long conferenceId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "total_quantity", nullable = false)
    private int totalQuantity;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "available_from")
    private LocalDateTime availableFrom;

    @Column(name = "available_until")
    private LocalDateTime availableUntil;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "addon_required_ticket_types", joinColumns = @JoinColumn(name = "addon_id"))
    @Column(name = "ticket_type_id")
    @Builder.Default
    private Set<Long> requiredTicketTypeIds = new HashSet<>();

    public boolean hasPrerequisites() {
        return !requiredTicketTypeIds.isEmpty();
    }

    /**
     * 주어진 티켓 유형 중 하나라도 선행 조건을 만족하는지 확인
     */
    public boolean isSatisfiedBy(Set<Long> ticketTypeIdsInCart) {
        if (!hasPrerequisites()) {
            return true;
        }
        for (Long required : requiredTicketTypeIds) {
            if (ticketTypeIdsInCart.contains(required)) {
                return true;
            }
        }
        return false;
    }
}
