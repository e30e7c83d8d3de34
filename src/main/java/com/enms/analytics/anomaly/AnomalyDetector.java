package com.enms.analytics.anomaly;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Stateless checks over an ascending bucketed series.
 * Points before {@code evaluateFrom} only seed the rolling window.
 */
public class AnomalyDetector {

    private static final double EPSILON = 1e-9;

    /** A change of at least this share of the current deviation counts as abrupt. */
    private static final double ABRUPT_CHANGE_RATIO = 0.5;

    private final int rollingWindow;
    private final int minWindow;

    public AnomalyDetector(int rollingWindow, int minWindow) {
        if (minWindow < 2 || rollingWindow < minWindow) {
            throw new IllegalArgumentException("Window sizes must satisfy 2 <= min <= rolling");
        }
        this.rollingWindow = rollingWindow;
        this.minWindow = minWindow;
    }

    /**
     * Flag points beyond k standard deviations of the mean of the previous {@code rollingWindow} points.
     */
    public List<AnomalyFinding> detectStatistical(List<SeriesPoint> series, LocalDateTime evaluateFrom,
                                                  SeverityThresholds thresholds) {
        List<AnomalyFinding> findings = new ArrayList<>();
        DescriptiveStatistics window = new DescriptiveStatistics(rollingWindow);
        Double previousDeviation = null;

        for (SeriesPoint point : series) {
            Double deviation = null;
            if (window.getN() >= minWindow) {
                double mean = window.getMean();
                double std = window.getStandardDeviation();
                deviation = point.observed() - mean;

                if (!point.time().isBefore(evaluateFrom) && std > EPSILON) {
                    double zScore = deviation / std;
                    Severity severity = thresholds.forZScore(zScore);
                    if (severity != Severity.NORMAL) {
                        findings.add(new AnomalyFinding(point.time(), point.observed(), mean,
                                Math.abs(mean) > EPSILON ? deviation / mean * 100.0 : null,
                                zScore, severity, classify(deviation, previousDeviation),
                                DetectionMethod.STATISTICAL));
                    }
                }
            }
            previousDeviation = deviation;
            window.addValue(point.observed());
        }
        return findings;
    }

    /**
     * Flag points whose deviation from the baseline prediction exceeds a percentage threshold.
     * Points without a positive expectation are skipped.
     */
    public List<AnomalyFinding> detectModelDeviation(List<SeriesPoint> series, LocalDateTime evaluateFrom,
                                                     SeverityThresholds thresholds) {
        List<AnomalyFinding> findings = new ArrayList<>();
        Double previousDeviation = null;

        for (SeriesPoint point : series) {
            if (point.expected() == null || point.expected() <= EPSILON) {
                previousDeviation = null;
                continue;
            }
            double deviation = point.observed() - point.expected();
            double deviationPercent = deviation / point.expected() * 100.0;

            if (!point.time().isBefore(evaluateFrom)) {
                Severity severity = thresholds.forDeviationPercent(deviationPercent);
                if (severity != Severity.NORMAL) {
                    findings.add(new AnomalyFinding(point.time(), point.observed(), point.expected(),
                            deviationPercent, null, severity, classify(deviation, previousDeviation),
                            DetectionMethod.MODEL_DEVIATION));
                }
            }
            previousDeviation = deviation;
        }
        return findings;
    }

    /**
     * Classify from the sign of the deviation and how fast it changed since the previous point:
     * an abrupt change is a spike or drop, a gradual same-signed change is drift.
     */
    public static AnomalyType classify(double deviation, Double previousDeviation) {
        if (Double.isNaN(deviation) || Math.abs(deviation) < EPSILON) {
            return AnomalyType.UNKNOWN;
        }
        double previous = previousDeviation == null ? 0.0 : previousDeviation;
        double change = deviation - previous;
        boolean sameSign = Math.signum(previous) == Math.signum(deviation);

        if (sameSign && Math.abs(change) < ABRUPT_CHANGE_RATIO * Math.abs(deviation)) {
            return AnomalyType.DRIFT;
        }
        return deviation > 0 ? AnomalyType.SPIKE : AnomalyType.DROP;
    }
}
