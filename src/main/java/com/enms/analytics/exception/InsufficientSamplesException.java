package com.enms.analytics.exception;

import lombok.Getter;

@Getter
public class InsufficientSamplesException extends AnalyticsException {

    private final int samples;
    private final int required;

    public InsufficientSamplesException(int samples, int required) {
        super(ErrorKind.INSUFFICIENT_SAMPLES,
                "Insufficient training samples: " + samples + " (minimum: " + required + ")");
        this.samples = samples;
        this.required = required;
    }
}
