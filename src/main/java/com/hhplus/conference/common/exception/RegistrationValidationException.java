package com.hhplus.conference.common.exception;

/**
 * RegistrationValidationException - 등록 흐름의 검증 실패
 *
 * 장바구니, 결제, 주문 상태 전환에서 발생하는 모든 검증 실패의 공통 타입.
 * 호출자는 메시지를 그대로 사용자에게 보여주고 재시도하지 않는다.
 */
public class RegistrationValidationException extends DomainException {

    public RegistrationValidationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public RegistrationValidationException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
