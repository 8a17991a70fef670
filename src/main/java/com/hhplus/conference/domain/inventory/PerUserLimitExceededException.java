package com.hhplus.conference.domain.inventory;

import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.common.exception.RegistrationValidationException;

/**
 * 장바구니 + 기존 구매 수량이 1인 한도를 넘을 때
 */
public class PerUserLimitExceededException extends RegistrationValidationException {

    public PerUserLimitExceededException(String itemName, int limitPerUser, long alreadyHeld) {
        super(ErrorCode.PER_USER_LIMIT_EXCEEDED,
                "'" + itemName + "' 1인 한도 " + limitPerUser + "개, 이미 보유 " + alreadyHeld + "개");
    }
}
