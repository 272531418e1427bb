package com.flagship.exchange_ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Error categories surfaced to callers. Only {@link #CONCURRENCY_CONFLICT}
 * is transient; every other category is permanent for the given input.
 */
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, false),
    INSUFFICIENT_FUNDS(HttpStatus.UNPROCESSABLE_ENTITY, false),
    NOT_FOUND(HttpStatus.NOT_FOUND, false),
    NO_ACTIVE_DRAWER(HttpStatus.CONFLICT, false),
    UNAUTHORIZED(HttpStatus.FORBIDDEN, false),
    INVALID_STATE(HttpStatus.CONFLICT, false),
    COMPLIANCE_BLOCKED(HttpStatus.UNPROCESSABLE_ENTITY, false),
    CONCURRENCY_CONFLICT(HttpStatus.CONFLICT, true),
    PERSISTENCE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, false);

    private final HttpStatus status;
    private final boolean retryable;

    ErrorCode(HttpStatus status, boolean retryable) {
        this.status = status;
        this.retryable = retryable;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
