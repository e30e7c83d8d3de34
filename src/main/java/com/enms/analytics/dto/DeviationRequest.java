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
 * Deviation of an observed value from a stored model; {@code version} null selects the latest usable one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviationRequest {

    @NotNull(message = "Target type is required")
    private TargetType targetType;

    @NotBlank(message = "Target id is required")
    private String targetId;

    @NotBlank(message = "Energy source is required")
    private String energySource;

    @NotNull(message = "Actual value is required")
    private Double actual;

    @NotEmpty(message = "Feature values are required")
    private Map<String, Double> features;

    private Integer version;
}
