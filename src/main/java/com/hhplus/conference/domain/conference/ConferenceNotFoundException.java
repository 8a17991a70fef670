package com.hhplus.conference.domain.conference;

import com.hhplus.conference.common.exception.DomainException;
import com.hhplus.conference.common.exception.ErrorCode;

public class ConferenceNotFoundException extends DomainException {

    public ConferenceNotFoundException(Long conferenceId) {
        super(ErrorCode.CONFERENCE_NOT_FOUND, "conferenceId=" + conferenceId);
    }

    public ConferenceNotFoundException(String slug) {
        super(ErrorCode.CONFERENCE_NOT_FOUND, "slug=" + slug);
    }
}
