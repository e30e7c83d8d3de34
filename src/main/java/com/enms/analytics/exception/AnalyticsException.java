package com.enms.analytics.exception;

import lombok.Getter;

/**
 * Base class for all errors reported to callers with a specific reason.
 */
@Getter
public abstract class AnalyticsException extends RuntimeException {

    private final ErrorKind kind;

    protected AnalyticsException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AnalyticsException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
