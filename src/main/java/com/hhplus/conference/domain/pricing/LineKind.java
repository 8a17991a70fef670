package com.hhplus.conference.domain.pricing;

public enum LineKind {
    TICKET,
    ADDON
}
