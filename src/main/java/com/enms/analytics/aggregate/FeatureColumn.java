package com.enms.analytics.aggregate;

/**
 * One resolved feature: its name and the SQL aggregate that computes it.
 */
public record FeatureColumn(String featureName, String expression) {
}
