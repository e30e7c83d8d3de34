package com.enms.analytics.anomaly;

public enum DetectionMethod {
    /** Distance from a rolling mean in standard deviations. */
    STATISTICAL,
    /** Percentage deviation from the baseline prediction. */
    MODEL_DEVIATION
}
