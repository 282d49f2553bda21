package com.alphaguard.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    REGISTRY_CONFLICT("REGISTRY_CONFLICT", 409),
    ILLEGAL_TRANSITION("ILLEGAL_TRANSITION", 409),
    EMPTY_POOL("EMPTY_POOL", 422),
    METRIC_UNAVAILABLE("METRIC_UNAVAILABLE", 424),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    AUDIT_STORAGE_UNAVAILABLE("AUDIT_STORAGE_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
