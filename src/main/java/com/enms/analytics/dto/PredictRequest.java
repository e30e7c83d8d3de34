package com.enms.analytics.dto;

import com.enms.analytics.baseline.TargetType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Prediction against a stored model; {@code version} null selects the latest usable one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictRequest {

    @NotNull(message = "Target type is required")
    private TargetType targetType;

    @NotBlank(message = "Target id is required")
    private String targetId;

    @NotBlank(message = "Energy source is required")
    private String energySource;

    private Integer version;

    @NotEmpty(message = "Feature values are required")
    private Map<String, Double> features;
}
