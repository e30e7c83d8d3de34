package com.enms.analytics.performance;

/**
 * Where the day's expected consumption came from.
 */
public enum BaselineSource {
    REGRESSION,
    ROLLING_AVERAGE,
    UNAVAILABLE
}
