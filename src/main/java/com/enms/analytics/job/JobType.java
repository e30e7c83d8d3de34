package com.enms.analytics.job;

public enum JobType {
    BASELINE_TRAINING,
    ANOMALY_SWEEP
}
