package com.enms.analytics.anomaly;

import java.time.LocalDateTime;

/**
 * One flagged bucket before persistence.
 */
public record AnomalyFinding(LocalDateTime detectedAt,
                             double observedValue,
                             double expectedValue,
                             Double deviationPercent,
                             Double zScore,
                             Severity severity,
                             AnomalyType type,
                             DetectionMethod method) {
}
