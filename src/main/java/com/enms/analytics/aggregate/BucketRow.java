package com.enms.analytics.aggregate;

import lombok.Getter;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Feature values of one time bucket. Missing values are absent or null.
 */
@Getter
public class BucketRow {

    private final LocalDateTime bucketStart;
    private final Map<String, Double> values = new LinkedHashMap<>();

    public BucketRow(LocalDateTime bucketStart) {
        this.bucketStart = bucketStart;
    }

    public void put(String featureName, Double value) {
        values.put(featureName, value);
    }

    public Double get(String featureName) {
        return values.get(featureName);
    }

    public boolean hasAll(List<String> featureNames) {
        for (String name : featureNames) {
            if (values.get(name) == null) {
                return false;
            }
        }
        return true;
    }

    public double[] toArray(List<String> featureNames) {
        double[] result = new double[featureNames.size()];
        for (int i = 0; i < featureNames.size(); i++) {
            result[i] = values.get(featureNames.get(i));
        }
        return result;
    }
}
