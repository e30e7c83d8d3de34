package com.enms.analytics.config;

import com.enms.analytics.aggregate.Resolution;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "baseline")
public class BaselineProperties {

    /** Complete rows required before a model is fitted. */
    private int minSamples = 30;

    /** Complete rows required per regression feature. */
    private int samplesPerFeature = 10;

    private double goodR2 = 0.80;

    private double acceptableR2 = 0.70;

    /** Resolutions tried for training, finest first. */
    private List<Resolution> trainingResolutions = new ArrayList<>(List.of(Resolution.HOURLY, Resolution.DAILY));

    private AutoSelect autoSelect = new AutoSelect();

    @Data
    public static class AutoSelect {
        private int maxFeatures = 4;
    }

    public int requiredSamples(int featureCount) {
        return Math.max(minSamples, samplesPerFeature * featureCount);
    }
}
