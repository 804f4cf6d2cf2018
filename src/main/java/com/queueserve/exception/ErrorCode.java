package com.queueserve.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INVALID_TRANSITION("INVALID_TRANSITION", 409),
    CONFLICT("CONFLICT", 409),
    ITEM_UNAVAILABLE("ITEM_UNAVAILABLE", 422),
    EMPTY_ORDER("EMPTY_ORDER", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    NOTIFICATION_DELIVERY_FAILED("NOTIFICATION_DELIVERY_FAILED", 502);

    private final String code;
    private final int httpStatus;
}
