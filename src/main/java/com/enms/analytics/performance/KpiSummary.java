package com.enms.analytics.performance;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Key performance indicators of a set of equipment units over a period.
 * Demand figures are in consumption units per hour.
 */
@Data
@Builder
public class KpiSummary {

    private String energySource;
    private LocalDateTime from;
    private LocalDateTime to;
    private double hours;
    private double totalConsumption;
    private double averageDemand;
    private Double peakDemand;

    /** Average over peak demand; null without a peak. */
    private Double loadFactor;

    private Double productionCount;

    /** Consumption per production unit; null without production. */
    private Double specificEnergyConsumption;

    private double energyCost;
    private double carbonEmissionsKg;
}
