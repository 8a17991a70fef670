package com.hhplus.conference.domain.catalog;

import com.hhplus.conference.common.exception.DomainException;
import com.hhplus.conference.common.exception.ErrorCode;

public class AddOnNotFoundException extends DomainException {

    public AddOnNotFoundException(Long addOnId) {
        super(ErrorCode.ADDON_NOT_FOUND, "addOnId=" + addOnId);
    }
}
