package com.enms.analytics.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Actual versus baseline-expected value. Positive deviation means over-consumption.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviationResult {

    private int modelVersion;
    private double expected;
    private double actual;
    private double deviation;

    /** Null when the expectation is zero. */
    private Double deviationPercent;
}
