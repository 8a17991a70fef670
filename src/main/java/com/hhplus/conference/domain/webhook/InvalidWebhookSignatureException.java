package com.hhplus.conference.domain.webhook;

import com.hhplus.conference.common.exception.DomainException;
import com.hhplus.conference.common.exception.ErrorCode;

public class InvalidWebhookSignatureException extends DomainException {

    public InvalidWebhookSignatureException(String detailMessage) {
        super(ErrorCode.INVALID_WEBHOOK_SIGNATURE, detailMessage);
    }

    public InvalidWebhookSignatureException(String detailMessage, Throwable cause) {
        super(ErrorCode.INVALID_WEBHOOK_SIGNATURE, detailMessage, cause);
    }
}
