package com.hhplus.conference.domain.pricing;

import com.hhplus.conference.domain.common.vo.Money;
import lombok.Getter;

import java.util.Objects;

/**
 * 할인 계산 입력 라인 (장바구니 한 줄의 불변 값 사본)
 */
@Getter
public final class PricingLine {

    private final Long itemId;
    private final LineKind kind;
    private final Long skuId;
    private final String description;
    private final int quantity;
    private final Money unitPrice;

    private PricingLine(Long itemId, LineKind kind, Long skuId, String description, int quantity, Money unitPrice) {
        this.itemId = itemId;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.skuId = Objects.requireNonNull(skuId, "skuId");
        this.description = description;
        this.quantity = quantity;
        this.unitPrice = Objects.requireNonNull(unitPrice, "unitPrice");
    }

    public static PricingLine ticket(Long itemId, Long ticketTypeId, String description, int quantity, Money unitPrice) {
        return new PricingLine(itemId, LineKind.TICKET, ticketTypeId, description, quantity, unitPrice);
    }

    public static PricingLine addOn(Long itemId, Long addOnId, String description, int quantity, Money unitPrice) {
        return new PricingLine(itemId, LineKind.ADDON, addOnId, description, quantity, unitPrice);
    }

    public Money lineTotal() {
        return unitPrice.multiply(quantity);
    }
}
