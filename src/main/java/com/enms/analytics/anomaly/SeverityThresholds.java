package com.enms.analytics.anomaly;

import com.enms.analytics.config.DetectionProperties;
import com.google.common.base.Preconditions;

/**
 * Severity cut-offs for both checks: sigma multiples for the statistical check,
 * absolute deviation percentages for the model check.
 */
public record SeverityThresholds(double warningSigma, double criticalSigma,
                                 double warningDeviationPercent, double criticalDeviationPercent) {

    public SeverityThresholds {
        Preconditions.checkArgument(warningSigma > 0 && warningSigma <= criticalSigma,
                "Sigma thresholds must satisfy 0 < warning <= critical");
        Preconditions.checkArgument(warningDeviationPercent > 0 && warningDeviationPercent <= criticalDeviationPercent,
                "Deviation thresholds must satisfy 0 < warning <= critical");
    }

    public static SeverityThresholds from(DetectionProperties properties) {
        return new SeverityThresholds(properties.getWarningSigma(), properties.getCriticalSigma(),
                properties.getWarningDeviationPercent(), properties.getCriticalDeviationPercent());
    }

    public Severity forZScore(double zScore) {
        double magnitude = Math.abs(zScore);
        if (magnitude >= criticalSigma) {
            return Severity.CRITICAL;
        }
        if (magnitude >= warningSigma) {
            return Severity.WARNING;
        }
        return Severity.NORMAL;
    }

    public Severity forDeviationPercent(double deviationPercent) {
        double magnitude = Math.abs(deviationPercent);
        if (magnitude >= criticalDeviationPercent) {
            return Severity.CRITICAL;
        }
        if (magnitude >= warningDeviationPercent) {
            return Severity.WARNING;
        }
        return Severity.NORMAL;
    }
}
