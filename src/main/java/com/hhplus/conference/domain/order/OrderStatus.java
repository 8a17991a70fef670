package com.hhplus.conference.domain.order;

import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

/**
 * OrderStatus - 주문 상태와 허용 전환
 *
 * 상태 전환 규칙 (이 외의 전환은 모두 거부):
 * PENDING → PAID
 * PENDING → CANCELLED
 * PAID → REFUNDED
 * PAID → PARTIALLY_REFUNDED
 */
@Getter
public enum OrderStatus {
    PENDING("결제 대기"),
    PAID("결제 완료"),
    REFUNDED("전액 환불"),
    PARTIALLY_REFUNDED("부분 환불"),
    CANCELLED("주문 취소");

    /**
     * 재고를 확정 점유하는 상태 (보류 기간과 무관)
     */
    public static final Set<OrderStatus> INVENTORY_COMMITTED = EnumSet.of(PAID, PARTIALLY_REFUNDED);

    private final String displayName;

    OrderStatus(String displayName) {
        this.displayName = displayName;
    }

    public boolean canTransitionTo(OrderStatus target) {
        switch (this) {
            case PENDING:
                return target == PAID || target == CANCELLED;
            case PAID:
                return target == REFUNDED || target == PARTIALLY_REFUNDED;
            default:
                return false;
        }
    }
}
