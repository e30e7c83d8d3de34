package com.enms.analytics.exception;

public class ResourceNotFoundException extends AnalyticsException {

    public ResourceNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
