package com.enms.analytics.aggregate;

public enum FeatureRole {
    /** Consumption the baseline predicts. One per energy source. */
    TARGET,
    /** Independent variable usable by regression. */
    DRIVER,
    /** Reported but never regressed on. */
    METADATA
}
