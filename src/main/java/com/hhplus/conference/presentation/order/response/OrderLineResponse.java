package com.hhplus.conference.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.conference.application.order.dto.OrderLineResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineResponse {

    private String description;

    private Integer quantity;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @JsonProperty("discount_amount")
    private BigDecimal discountAmount;

    @JsonProperty("line_total")
    private BigDecimal lineTotal;

    public static OrderLineResponse from(OrderLineResult line) {
        return OrderLineResponse.builder()
                .description(line.getDescription())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .discountAmount(line.getDiscountAmount())
                .lineTotal(line.getLineTotal())
                .build();
    }
}
