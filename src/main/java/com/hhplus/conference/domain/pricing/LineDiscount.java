package com.hhplus.conference.domain.pricing;

import com.hhplus.conference.domain.common.vo.Money;
import lombok.Getter;

/**
 * 라인별 할인 결과
 */
@Getter
public final class LineDiscount {

    private final PricingLine line;
    private final Money lineTotal;
    private final Money discount;

    LineDiscount(PricingLine line, Money discount) {
        this.line = line;
        this.lineTotal = line.lineTotal();
        this.discount = discount;
    }

    /**
     * 할인 적용 후 라인 금액
     */
    public Money getDiscountedTotal() {
        return lineTotal.subtractFloorZero(discount);
    }
}
