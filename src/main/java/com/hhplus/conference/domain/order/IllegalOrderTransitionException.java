package com.hhplus.conference.domain.order;

import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.common.exception.RegistrationValidationException;
import lombok.Getter;

/**
 * 허용되지 않은 주문 상태 전환 시도 (현재 상태와 목표 상태를 함께 보고)
 */
@Getter
public class IllegalOrderTransitionException extends RegistrationValidationException {

    private final OrderStatus currentStatus;
    private final OrderStatus attemptedStatus;

    public IllegalOrderTransitionException(Long orderId, OrderStatus currentStatus, OrderStatus attemptedStatus) {
        super(ErrorCode.ILLEGAL_ORDER_TRANSITION,
                "orderId=" + orderId + ", " + currentStatus.name() + " → " + attemptedStatus.name());
        this.currentStatus = currentStatus;
        this.attemptedStatus = attemptedStatus;
    }
}
