package com.hhplus.conference.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.conference.application.order.dto.OrderResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {

    @JsonProperty("order_id")
    private Long orderId;

    private String reference;

    private String status;

    private BigDecimal subtotal;

    @JsonProperty("discount_amount")
    private BigDecimal discountAmount;

    private BigDecimal total;

    @JsonProperty("voucher_code")
    private String voucherCode;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'")
    @JsonProperty("hold_expires_at")
    private LocalDateTime holdExpiresAt;

    @JsonProperty("line_items")
    private List<OrderLineResponse> lineItems;

    public static OrderResponse from(OrderResult result) {
        return OrderResponse.builder()
                .orderId(result.getOrderId())
                .reference(result.getReference())
                .status(result.getStatus().name())
                .subtotal(result.getSubtotal())
                .discountAmount(result.getDiscountAmount())
                .total(result.getTotal())
                .voucherCode(result.getVoucherCode())
                .holdExpiresAt(result.getHoldExpiresAt())
                .lineItems(result.getLineItems().stream()
                        .map(OrderLineResponse::from)
                        .collect(Collectors.toList()))
                .build();
    }
}
