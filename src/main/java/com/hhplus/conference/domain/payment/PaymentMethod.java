package com.hhplus.conference.domain.payment;

public enum PaymentMethod {
    STRIPE,
    COMP,
    CREDIT,
    MANUAL
}
