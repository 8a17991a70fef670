package com.hhplus.conference.domain.payment;

import java.util.EnumSet;
import java.util.Set;

public enum PaymentStatus {
    PENDING,
    PROCESSING,
    SUCCEEDED,
    FAILED,
    REFUNDED;

    /**
     * 결제 실패 이벤트로 FAILED 처리할 수 있는 상태
     */
    public static final Set<PaymentStatus> IN_FLIGHT = EnumSet.of(PENDING, PROCESSING);
}
