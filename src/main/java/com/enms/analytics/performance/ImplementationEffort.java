package com.enms.analytics.performance;

public enum ImplementationEffort {
    LOW,
    MEDIUM,
    HIGH
}
