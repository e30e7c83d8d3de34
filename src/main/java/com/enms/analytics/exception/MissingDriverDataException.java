package com.enms.analytics.exception;

import lombok.Getter;

@Getter
public class MissingDriverDataException extends AnalyticsException {

    private final String featureName;

    public MissingDriverDataException(String featureName) {
        super(ErrorKind.MISSING_DRIVER_DATA,
                "Driver '" + featureName + "' has no data in the requested time range");
        this.featureName = featureName;
    }
}
