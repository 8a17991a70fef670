package com.hhplus.conference.application.order.dto;

import com.hhplus.conference.domain.order.OrderLineItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineResult {
    private String description;
    private int quantity;
    private BigDecimal unitPrice;
    private BigDecimal discountAmount;
    private BigDecimal lineTotal;

    public static OrderLineResult from(OrderLineItem lineItem) {
        return OrderLineResult.builder()
                .description(lineItem.getDescription())
                .quantity(lineItem.getQuantity())
                .unitPrice(lineItem.getUnitPrice())
                .discountAmount(lineItem.getDiscountAmount())
                .lineTotal(lineItem.getLineTotal())
                .build();
    }
}
