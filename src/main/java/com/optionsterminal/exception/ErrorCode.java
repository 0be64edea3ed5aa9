package com.optionsterminal.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_CONNECTED("NOT_CONNECTED", 401),
    NOT_FOUND("NOT_FOUND", 404),
    RATE_LIMITED("RATE_LIMITED", 429),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    BROKER_ERROR("BROKER_ERROR", 502),
    PACING_TIMEOUT("PACING_TIMEOUT", 504);

    private final String code;
    private final int httpStatus;
}
