package com.hhplus.conference.domain.voucher;

import com.hhplus.conference.common.exception.ErrorCode;
import com.hhplus.conference.common.exception.RegistrationValidationException;

/**
 * 바우처가 비활성, 소진, 기간 외이거나 코드가 존재하지 않을 때
 */
public class InvalidVoucherException extends RegistrationValidationException {

    private InvalidVoucherException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public static InvalidVoucherException unknownCode(String code) {
        return new InvalidVoucherException(ErrorCode.VOUCHER_NOT_FOUND, "code=" + code);
    }

    public static InvalidVoucherException notValid(String code) {
        return new InvalidVoucherException(ErrorCode.INVALID_VOUCHER,
                "바우처 '" + code + "'은(는) 만료되었거나 더 이상 사용할 수 없습니다");
    }
}
