package com.enms.analytics.exception;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable error kinds returned to API callers.
 */
public enum ErrorKind {

    UNKNOWN_FEATURE(HttpStatus.UNPROCESSABLE_ENTITY),
    NO_AGGREGATE_TABLE(HttpStatus.UNPROCESSABLE_ENTITY),
    INSUFFICIENT_SAMPLES(HttpStatus.UNPROCESSABLE_ENTITY),
    MISSING_DRIVER_DATA(HttpStatus.UNPROCESSABLE_ENTITY),
    INSUFFICIENT_PARTIAL_DATA(HttpStatus.UNPROCESSABLE_ENTITY),
    NO_DATA_FOR_PERIOD(HttpStatus.NOT_FOUND),
    TRAINING_IN_PROGRESS(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
