package com.hhplus.conference.common.exception;

/**
 * 도메인 규칙 위반 (4XX)
 *
 * 찾을 수 없는 리소스, 잘못된 웹훅 서명 등 호출자 쪽 문제를 나타낸다.
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }

    public DomainException(ErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode, detail, cause);
    }
}
