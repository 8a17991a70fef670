package com.hhplus.conference.domain.order.event;

import com.hhplus.conference.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 결제 완료 이벤트
 *
 * Kafka 메시지 값으로 그대로 직렬화된다 (Key: reference).
 */
@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class OrderPaidEvent {

    private Long orderId;
    private String reference;
    private Long userId;
    private Long conferenceId;
    private BigDecimal total;
    private String billingEmail;
    private LocalDateTime paidAt;

    public static OrderPaidEvent from(Order order) {
        return OrderPaidEvent.builder()
                .orderId(order.getOrderId())
                .reference(order.getReference())
                .userId(order.getUserId())
                .conferenceId(order.getConferenceId())
                .total(order.getTotal())
                .billingEmail(order.getBillingEmail())
                .paidAt(order.getUpdatedAt())
                .build();
    }
}
