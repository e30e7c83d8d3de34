package com.enms.analytics.dto;

import com.enms.analytics.aggregate.AggregationFunction;
import com.enms.analytics.aggregate.FeatureRole;
import com.enms.analytics.persistence.FeatureDefinitionEntity;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class FeatureSummary {

    private String featureName;
    private FeatureRole role;
    private String sourceTable;
    private String sourceColumn;
    private AggregationFunction aggregationFunction;
    private String description;

    public static FeatureSummary from(FeatureDefinitionEntity entity) {
        return FeatureSummary.builder()
                .featureName(entity.getFeatureName())
                .role(entity.getRole())
                .sourceTable(entity.getSourceTable())
                .sourceColumn(entity.getSourceColumn())
                .aggregationFunction(entity.getAggregationFunction())
                .description(entity.getDescription())
                .build();
    }
}
