package com.enms.analytics.anomaly;

import java.time.LocalDateTime;

/**
 * Observed bucket value; {@code expected} is the baseline prediction when one is available.
 */
public record SeriesPoint(LocalDateTime time, double observed, Double expected) {
}
