package com.hhplus.conference.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.conference.common.exception.BizException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * 모든 API 오류의 단일 응답 본문
 *
 * {"error_code": ..., "error_message": ..., "timestamp": ..., "request_id": ...}
 * request_id 는 서버 로그와 대조하기 위한 값으로 응답마다 새로 만든다.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ErrorResponse {

    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String INTERNAL_SERVER_ERROR = "INTERNAL_SERVER_ERROR";

    @JsonProperty("error_code")
    private final String errorCode;

    @JsonProperty("error_message")
    private final String errorMessage;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private final Instant timestamp;

    @JsonProperty("request_id")
    private final String requestId;

    public static ErrorResponse from(BizException e) {
        return of(e.getErrorCode().getCode(), e.getMessage());
    }

    public static ErrorResponse invalidRequest(String message) {
        return of(INVALID_REQUEST, message);
    }

    public static ErrorResponse of(String errorCode, String errorMessage) {
        String requestId = "req-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        return new ErrorResponse(errorCode, errorMessage, Instant.now(), requestId);
    }
}
