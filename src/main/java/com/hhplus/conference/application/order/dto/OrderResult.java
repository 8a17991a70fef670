package com.hhplus.conference.application.order.dto;

import com.hhplus.conference.domain.order.Order;
import com.hhplus.conference.domain.order.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResult {
    private Long orderId;
    private String reference;
    private OrderStatus status;
    private BigDecimal subtotal;
    private BigDecimal discountAmount;
    private BigDecimal total;
    private String voucherCode;
    private LocalDateTime holdExpiresAt;
    private List<OrderLineResult> lineItems;

    public static OrderResult from(Order order) {
        return OrderResult.builder()
                .orderId(order.getOrderId())
                .reference(order.getReference())
                .status(order.getStatus())
                .subtotal(order.getSubtotal())
                .discountAmount(order.getDiscountAmount())
                .total(order.getTotal())
                .voucherCode(order.getVoucherCode())
                .holdExpiresAt(order.getHoldExpiresAt())
                .lineItems(order.getLineItems().stream()
                        .map(OrderLineResult::from)
                        .collect(Collectors.toList()))
                .build();
    }
}
