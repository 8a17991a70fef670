package com.hhplus.conference.application.cart.dto;

import com.hhplus.conference.domain.pricing.LineDiscount;
import com.hhplus.conference.domain.pricing.LineKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 장바구니 한 줄의 가격 미리보기 (Application layer 내부 DTO)
 *
 * lineTotal 은 할인 적용 후 금액이다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartLineSummary {
    private Long itemId;
    private LineKind kind;
    private Long skuId;
    private String description;
    private int quantity;
    private BigDecimal unitPrice;
    private BigDecimal discount;
    private BigDecimal lineTotal;

    public static CartLineSummary from(LineDiscount lineDiscount) {
        return CartLineSummary.builder()
                .itemId(lineDiscount.getLine().getItemId())
                .kind(lineDiscount.getLine().getKind())
                .skuId(lineDiscount.getLine().getSkuId())
                .description(lineDiscount.getLine().getDescription())
                .quantity(lineDiscount.getLine().getQuantity())
                .unitPrice(lineDiscount.getLine().getUnitPrice().getAmount())
                .discount(lineDiscount.getDiscount().getAmount())
                .lineTotal(lineDiscount.getDiscountedTotal().getAmount())
                .build();
    }
}
