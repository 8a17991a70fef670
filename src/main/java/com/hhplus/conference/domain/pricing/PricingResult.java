package com.hhplus.conference.domain.pricing;

import com.hhplus.conference.domain.common.vo.Money;
import lombok.Getter;

import java.util.List;

/**
 * 장바구니 전체 가격 계산 결과
 *
 * total = max(subtotal − discount, 0)
 */
@Getter
public final class PricingResult {

    private final List<LineDiscount> lines;
    private final Money subtotal;
    private final Money discount;
    private final Money total;

    PricingResult(List<LineDiscount> lines, Money subtotal, Money discount) {
        this.lines = List.copyOf(lines);
        this.subtotal = subtotal;
        this.discount = discount;
        this.total = subtotal.subtractFloorZero(discount);
    }
}
