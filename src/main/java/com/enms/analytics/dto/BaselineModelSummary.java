package com.enms.analytics.dto;

import com.enms.analytics.aggregate.Resolution;
import com.enms.analytics.baseline.QualityTier;
import com.enms.analytics.baseline.TargetType;
import com.enms.analytics.persistence.BaselineModelEntity;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
public class BaselineModelSummary {

    private Long modelId;
    private TargetType targetType;
    private String targetId;
    private String energySource;
    private int version;
    private List<String> featureNames;
    private double[] coefficients;
    private double intercept;

    @Getter(onMethod_ = @JsonProperty("rSquared"))
    private double rSquared;

    private double rmse;
    private double mae;
    private QualityTier qualityTier;
    private boolean meetsQualityThreshold;
    private Resolution resolution;
    private LocalDateTime trainingStart;
    private LocalDateTime trainingEnd;
    private int sampleCount;
    private boolean autoSelected;
    private LocalDateTime createdAt;

    public static BaselineModelSummary from(BaselineModelEntity model) {
        return BaselineModelSummary.builder()
                .modelId(model.getId())
                .targetType(model.getTargetType())
                .targetId(model.getTargetId())
                .energySource(model.getEnergySource())
                .version(model.getVersion())
                .featureNames(model.getFeatureNames())
                .coefficients(model.getCoefficients())
                .intercept(model.getIntercept())
                .rSquared(model.getRSquared())
                .rmse(model.getRmse())
                .mae(model.getMae())
                .qualityTier(model.getQualityTier())
                .meetsQualityThreshold(model.getQualityTier() == QualityTier.MEETS_THRESHOLD)
                .resolution(model.getResolution())
                .trainingStart(model.getTrainingStart())
                .trainingEnd(model.getTrainingEnd())
                .sampleCount(model.getSampleCount())
                .autoSelected(model.isAutoSelected())
                .createdAt(model.getCreatedAt())
                .build();
    }
}
