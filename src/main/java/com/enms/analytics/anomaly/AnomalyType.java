package com.enms.analytics.anomaly;

public enum AnomalyType {
    /** Abrupt rise above expectation. */
    SPIKE,
    /** Abrupt fall below expectation. */
    DROP,
    /** Persistent deviation in the same direction that changes slowly. */
    DRIFT,
    UNKNOWN
}
