package com.enms.analytics.exception;

import lombok.Getter;

@Getter
public class UnknownFeatureException extends AnalyticsException {

    private final String energySource;
    private final String featureName;

    public UnknownFeatureException(String energySource, String featureName) {
        super(ErrorKind.UNKNOWN_FEATURE,
                "Feature '" + featureName + "' is not registered for energy source '" + energySource + "'");
        this.energySource = energySource;
        this.featureName = featureName;
    }
}
