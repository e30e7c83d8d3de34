package com.enms.analytics.exception;

public class InsufficientPartialDataException extends AnalyticsException {

    public InsufficientPartialDataException(String message) {
        super(ErrorKind.INSUFFICIENT_PARTIAL_DATA, message);
    }
}
