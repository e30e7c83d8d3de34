package com.enms.analytics.performance;

/**
 * Full-day expected consumption and how much it can be trusted.
 */
public record BaselineEstimate(Double expected, BaselineSource source, Integer modelVersion,
                               double confidenceFactor) {

    public static BaselineEstimate unavailable() {
        return new BaselineEstimate(null, BaselineSource.UNAVAILABLE, null, 0.0);
    }

    public boolean isAvailable() {
        return expected != null;
    }
}
