package com.hhplus.conference.common.exception;

/**
 * ApplicationException - 사용자 입력과 무관한 처리 실패 (5XX)
 *
 * 주문 번호 생성 재시도 소진, 결제 대행사 호출 실패, 결제 키 미설정 등.
 * GlobalExceptionHandler 가 스택 트레이스와 함께 error 로그를 남긴다.
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }

    public ApplicationException(ErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode, detail, cause);
    }
}
