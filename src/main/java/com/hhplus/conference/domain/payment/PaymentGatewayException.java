package com.hhplus.conference.domain.payment;

import com.hhplus.conference.common.exception.ApplicationException;
import com.hhplus.conference.common.exception.ErrorCode;

/**
 * 결제 대행사 호출 실패 (502)
 */
public class PaymentGatewayException extends ApplicationException {

    public PaymentGatewayException(String detail, Throwable cause) {
        super(ErrorCode.PAYMENT_GATEWAY_ERROR, detail, cause);
    }
}
