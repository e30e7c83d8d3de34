package com.enms.analytics.config;

import com.enms.analytics.aggregate.Resolution;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Default severity thresholds for anomaly detection. Callers may override per request.
 */
@Data
@ConfigurationProperties(prefix = "anomaly")
public class DetectionProperties {

    private double warningSigma = 2.0;
    private double criticalSigma = 3.0;
    private double warningDeviationPercent = 15.0;
    private double criticalDeviationPercent = 30.0;

    /** Number of previous buckets forming the rolling mean. */
    private int rollingWindow = 24;

    /** Previous buckets required before a point can be judged. */
    private int minWindow = 6;

    private Resolution resolution = Resolution.HOURLY;

    /** Look-back of the scheduled sweep. */
    private int sweepHours = 2;
}
