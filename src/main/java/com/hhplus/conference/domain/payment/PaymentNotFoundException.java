package com.hhplus.conference.domain.payment;

import com.hhplus.conference.common.exception.DomainException;
import com.hhplus.conference.common.exception.ErrorCode;

public class PaymentNotFoundException extends DomainException {

    public PaymentNotFoundException(String paymentIntentId) {
        super(ErrorCode.PAYMENT_NOT_FOUND, "paymentIntentId=" + paymentIntentId);
    }
}
