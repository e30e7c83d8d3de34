package com.enms.analytics.performance;

import com.enms.analytics.config.PerformanceProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based scoring, classification and recommendations over a day's deviation.
 * All percentages are signed, positive meaning over-consumption.
 */
public class PerformanceRules {

    private static final double NORMAL_CONFIDENCE = 0.9;
    private static final double DEVIATION_CONFIDENCE = 0.7;

    private final PerformanceProperties properties;

    public PerformanceRules(PerformanceProperties properties) {
        this.properties = properties;
    }

    /**
     * Score from the magnitude of deviation, banded; 1.0 is best, 0.4 the floor.
     */
    public static double efficiencyScore(double deviationPercent) {
        double magnitude = Math.abs(deviationPercent);
        if (magnitude <= 5.0) {
            return 1.0;
        }
        if (magnitude <= 15.0) {
            return 0.8;
        }
        if (magnitude <= 30.0) {
            return 0.6;
        }
        return 0.4;
    }

    public RootCauseAnalysis rootCause(Double deviationPercent, double hoursElapsed,
                                       double baselineConfidence, long criticalAnomalies) {
        if (deviationPercent == null) {
            return RootCauseAnalysis.builder()
                    .primaryFactor(RootCause.UNKNOWN)
                    .impactDescription("No baseline available to assess consumption")
                    .contributingFactors(List.of())
                    .confidence(0.0)
                    .build();
        }

        double magnitude = Math.abs(deviationPercent);
        RootCause cause;
        String impact;
        List<String> factors = new ArrayList<>();

        if (deviationPercent > properties.getLoadShiftPercent()) {
            cause = RootCause.HIGH_DEMAND;
            impact = String.format("Consumption %.1f%% above baseline", magnitude);
            factors.add("Possible production increase");
            factors.add("Equipment degradation");
            factors.add("Inefficient operation");
        } else if (deviationPercent < -properties.getLoadShiftPercent()) {
            cause = RootCause.REDUCED_LOAD;
            impact = String.format("Consumption %.1f%% below baseline", magnitude);
            factors.add("Production decrease");
            factors.add("Equipment offline");
            factors.add("Process optimization");
        } else if (magnitude <= properties.getTolerancePercent()) {
            cause = RootCause.NORMAL_OPERATION;
            impact = "Consumption within expected range";
        } else {
            cause = RootCause.PROCESS_CHANGE;
            impact = String.format("Consumption %.1f%% %s baseline", magnitude,
                    deviationPercent > 0 ? "above" : "below");
            factors.add("Changed operating schedule or product mix");
            factors.add("Setpoint or parameter change");
        }

        if (criticalAnomalies > 0) {
            factors.add(criticalAnomalies + " critical anomalies detected");
        }

        double confidence = cause == RootCause.NORMAL_OPERATION ? NORMAL_CONFIDENCE : DEVIATION_CONFIDENCE;
        confidence *= 0.5 + 0.5 * Math.min(hoursElapsed, 24.0) / 24.0;
        confidence *= baselineConfidence;

        return RootCauseAnalysis.builder()
                .primaryFactor(cause)
                .impactDescription(impact)
                .contributingFactors(factors)
                .confidence(confidence)
                .build();
    }

    public ComplianceStatus complianceStatus(Double deviationPercent, long criticalAnomalies) {
        if (deviationPercent == null) {
            return ComplianceStatus.UNDETERMINED;
        }
        double tolerance = properties.getTolerancePercent();
        if (deviationPercent < -tolerance) {
            return ComplianceStatus.EXCELLENT;
        }
        if (deviationPercent <= tolerance) {
            return ComplianceStatus.ON_TARGET;
        }
        if (deviationPercent > properties.getSeverePercent()
                || criticalAnomalies >= properties.getSustainedCriticalAnomalies()) {
            return ComplianceStatus.NON_COMPLIANT;
        }
        return ComplianceStatus.REQUIRES_ATTENTION;
    }

    /**
     * Recommendations for unfavorable deviations beyond the actionable threshold; empty otherwise.
     */
    public List<Recommendation> recommendations(Double deviationPercent, Double deviation,
                                                double unitCost, long criticalAnomalies) {
        List<Recommendation> result = new ArrayList<>();
        if (deviationPercent == null || deviation == null
                || deviationPercent <= properties.getActionablePercent()) {
            return result;
        }

        double excess = Math.abs(deviation);
        if (deviationPercent > properties.getSeverePercent()) {
            result.add(recommendation("Investigate equipment efficiency", "maintenance", excess * 0.3, unitCost,
                    ImplementationEffort.MEDIUM, RecommendationPriority.HIGH, 30,
                    List.of("Schedule equipment inspection",
                            "Check for leaks or wear",
                            "Review operating parameters")));
            result.add(recommendation("Optimize operating schedule", "operational", excess * 0.2, unitCost,
                    ImplementationEffort.LOW, RecommendationPriority.HIGH, 7,
                    List.of("Review production schedule",
                            "Identify off-peak operations",
                            "Implement load shifting")));
        } else {
            result.add(recommendation("Review operational parameters", "operational", excess * 0.5, unitCost,
                    ImplementationEffort.LOW, RecommendationPriority.MEDIUM, 14,
                    List.of("Compare setpoints against the reference period",
                            "Check idle running between batches")));
        }

        if (criticalAnomalies > 0) {
            result.add(recommendation("Investigate critical anomalies", "maintenance", excess * 0.1, unitCost,
                    ImplementationEffort.LOW, RecommendationPriority.CRITICAL, 3,
                    List.of("Review the anomaly timeline for the day",
                            "Inspect equipment at the flagged intervals",
                            "Resolve anomalies with a root-cause note")));
        }
        return result;
    }

    private static Recommendation recommendation(String action, String type, double savings, double unitCost,
                                                 ImplementationEffort effort, RecommendationPriority priority,
                                                 int paybackDays, List<String> steps) {
        return Recommendation.builder()
                .action(action)
                .type(type)
                .estimatedSavings(savings)
                .estimatedSavingsCost(savings * unitCost)
                .effort(effort)
                .priority(priority)
                .expectedPaybackDays(paybackDays)
                .steps(steps)
                .build();
    }
}
