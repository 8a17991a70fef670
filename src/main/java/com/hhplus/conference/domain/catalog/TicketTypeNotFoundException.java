package com.hhplus.conference.domain.catalog;

import com.hhplus.conference.common.exception.DomainException;
import com.hhplus.conference.common.exception.ErrorCode;

public class TicketTypeNotFoundException extends DomainException {

    public TicketTypeNotFoundException(Long ticketTypeId) {
        super(ErrorCode.TICKET_TYPE_NOT_FOUND, "ticketTypeId=" + ticketTypeId);
    }
}
