package com.enms.analytics.exception;

public class InvalidRequestException extends AnalyticsException {

    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }
}
