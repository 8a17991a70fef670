package com.hhplus.conference.domain.credit;

public enum CreditStatus {
    AVAILABLE,
    APPLIED,
    EXPIRED
}
