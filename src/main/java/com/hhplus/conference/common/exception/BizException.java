package com.hhplus.conference.common.exception;

/**
 * BizException - 등록 서비스 예외의 최상위 클래스
 *
 * 예외 계층:
 * BizException
 * ├─ DomainException (규칙 위반, 4XX)
 * │   └─ RegistrationValidationException (사용자에게 그대로 보여주는 검증 실패)
 * └─ ApplicationException (처리 실패, 5XX)
 *
 * 메시지는 "{코드 메시지} | {상세}" 형식이다. 상세에는 식별자만 담고 비밀값은 담지 않는다.
 */
public abstract class BizException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String detail;

    protected BizException(ErrorCode errorCode, String detail) {
        this(errorCode, detail, null);
    }

    protected BizException(ErrorCode errorCode, String detail, Throwable cause) {
        super(compose(errorCode, detail), cause);
        this.errorCode = errorCode;
        this.detail = detail;
    }

    private static String compose(ErrorCode errorCode, String detail) {
        if (detail == null || detail.isBlank()) {
            return errorCode.getMessage();
        }
        return errorCode.getMessage() + " | " + detail;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getDetail() {
        return detail;
    }

    public int getStatusCode() {
        return errorCode.getStatusCode();
    }

    public boolean isServerError() {
        return getStatusCode() >= 500;
    }
}
