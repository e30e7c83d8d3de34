package com.enms.analytics.anomaly;

public enum Severity {
    NORMAL,
    WARNING,
    CRITICAL;

    public boolean isAbove(Severity other) {
        return ordinal() > other.ordinal();
    }
}
