package com.enms.analytics.performance;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * ISO 50001 alignment of a day's performance.
 */
public enum ComplianceStatus {
    /** Consumption well below baseline. */
    EXCELLENT,
    ON_TARGET,
    REQUIRES_ATTENTION,
    NON_COMPLIANT,
    /** No baseline to compare against. */
    UNDETERMINED;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
