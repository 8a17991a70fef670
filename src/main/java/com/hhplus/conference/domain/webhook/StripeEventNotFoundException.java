package com.hhplus.conference.domain.webhook;

import com.hhplus.conference.common.exception.DomainException;
import com.hhplus.conference.common.exception.ErrorCode;

public class StripeEventNotFoundException extends DomainException {

    public StripeEventNotFoundException(String stripeId) {
        super(ErrorCode.STRIPE_EVENT_NOT_FOUND, "stripeId=" + stripeId);
    }
}
