package com.enms.analytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Thresholds and prices used by the performance engine.
 */
@Data
@ConfigurationProperties(prefix = "performance")
public class PerformanceProperties {

    /** Minimum hours of the current day before it can be analyzed. */
    private double minPartialHours = 2.0;

    /** |deviation| within this percentage is on target. */
    private double tolerancePercent = 5.0;

    /** Unfavorable deviation above this percentage is non-compliant. */
    private double severePercent = 15.0;

    /** |deviation| above this percentage produces recommendations. */
    private double actionablePercent = 5.0;

    /** Root-cause classification bounds for high demand / reduced load. */
    private double loadShiftPercent = 20.0;

    private int baselineLookbackDays = 30;

    /** Critical anomalies in one day that make an unfavorable deviation sustained. */
    private int sustainedCriticalAnomalies = 3;

    private double defaultUnitCost = 0.15;

    private Map<String, Double> unitCost = new HashMap<>();

    /** kg CO2 per consumption unit. */
    private double defaultCarbonFactor = 0.4;

    private Map<String, Double> carbonFactor = new HashMap<>();

    /** Spoken consumption unit per energy source. */
    private Map<String, String> unitLabel = new HashMap<>();

    private String defaultUnitLabel = "kilowatt hours";

    private String currencySymbol = "$";

    /** Registered feature holding production output, used for specific energy consumption. */
    private String productionFeature = "production_count";

    public double unitCostFor(String energySource) {
        return unitCost.getOrDefault(energySource, defaultUnitCost);
    }

    public double carbonFactorFor(String energySource) {
        return carbonFactor.getOrDefault(energySource, defaultCarbonFactor);
    }

    public String unitLabelFor(String energySource) {
        return unitLabel.getOrDefault(energySource, defaultUnitLabel);
    }
}
