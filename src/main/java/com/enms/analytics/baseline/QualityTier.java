package com.enms.analytics.baseline;

/**
 * Fit-quality gate of a trained baseline (ISO 50001 aligned R² targets).
 */
public enum QualityTier {

    /** R² at or above the target; used without restriction. */
    MEETS_THRESHOLD(true, 1.0),

    /** Between the soft floor and the target; used, flagged, with reduced confidence. */
    ACCEPTABLE(true, 0.9),

    /** Below the soft floor; persisted for review but never used for deviation. */
    LOW_CONFIDENCE(false, 0.0);

    private final boolean usable;
    private final double confidenceFactor;

    QualityTier(boolean usable, double confidenceFactor) {
        this.usable = usable;
        this.confidenceFactor = confidenceFactor;
    }

    public boolean isUsable() {
        return usable;
    }

    public double getConfidenceFactor() {
        return confidenceFactor;
    }

    public static QualityTier of(double rSquared, double goodR2, double acceptableR2) {
        if (rSquared >= goodR2) {
            return MEETS_THRESHOLD;
        }
        if (rSquared >= acceptableR2) {
            return ACCEPTABLE;
        }
        return LOW_CONFIDENCE;
    }
}
