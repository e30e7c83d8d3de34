package com.enms.analytics.performance;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RootCause {
    HIGH_DEMAND,
    REDUCED_LOAD,
    NORMAL_OPERATION,
    PROCESS_CHANGE,
    UNKNOWN;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
