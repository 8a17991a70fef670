package com.hhplus.conference.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.conference.application.cart.dto.CartLineSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 장바구니 항목 응답 DTO (line_total 은 할인 후 금액)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemResponse {

    @JsonProperty("item_id")
    private Long itemId;

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("sku_id")
    private Long skuId;

    private String description;

    private Integer quantity;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    private BigDecimal discount;

    @JsonProperty("line_total")
    private BigDecimal lineTotal;

    public static CartItemResponse from(CartLineSummary line) {
        return CartItemResponse.builder()
                .itemId(line.getItemId())
                .kind(line.getKind().name())
                .skuId(line.getSkuId())
                .description(line.getDescription())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .discount(line.getDiscount())
                .lineTotal(line.getLineTotal())
                .build();
    }
}
