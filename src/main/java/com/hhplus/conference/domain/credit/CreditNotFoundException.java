package com.hhplus.conference.domain.credit;

import com.hhplus.conference.common.exception.DomainException;
import com.hhplus.conference.common.exception.ErrorCode;

public class CreditNotFoundException extends DomainException {

    public CreditNotFoundException(Long creditId) {
        super(ErrorCode.CREDIT_NOT_FOUND, "creditId=" + creditId);
    }
}
