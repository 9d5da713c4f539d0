package com.mltrading.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    TRANSPORT_ERROR("TRANSPORT_ERROR", 502),
    TRANSPORT_UNAVAILABLE("TRANSPORT_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
