package com.enms.analytics.performance;

public enum RecommendationPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
