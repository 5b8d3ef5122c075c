package com.flagship.bookkeeping.exception;

import org.springframework.http.HttpStatus;

/**
 * Broad classes of engine failure. Every category aborts the enclosing transaction;
 * they differ only in how the caller is expected to react.
 */
public enum ErrorCategory {

    /** Bad input. Never retried automatically. */
    VALIDATION(HttpStatus.BAD_REQUEST),

    /** Input is fine but the store is in the wrong state for it. */
    STATE_CONFLICT(HttpStatus.CONFLICT),

    /** Nothing to operate on. */
    NOT_FOUND(HttpStatus.NOT_FOUND),

    /** Referential damage detected mid-operation. */
    INTEGRITY(HttpStatus.UNPROCESSABLE_ENTITY);

    private final HttpStatus httpStatus;

    ErrorCategory(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
