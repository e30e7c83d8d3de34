package com.enms.analytics.dto;

import com.enms.analytics.anomaly.SeverityThresholds;
import com.enms.analytics.config.DetectionProperties;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectAnomaliesRequest {

    @NotBlank(message = "Equipment id is required")
    private String equipmentId;

    @NotBlank(message = "Energy source is required")
    private String energySource;

    @NotNull(message = "Window start is required")
    private LocalDateTime from;

    @NotNull(message = "Window end is required")
    private LocalDateTime to;

    // Optional overrides of the configured thresholds
    @Positive
    private Double warningSigma;

    @Positive
    private Double criticalSigma;

    @Positive
    private Double warningDeviationPercent;

    @Positive
    private Double criticalDeviationPercent;

    /**
     * Thresholds with any overrides applied, or null when nothing was overridden.
     */
    public SeverityThresholds toThresholds(DetectionProperties defaults) {
        if (warningSigma == null && criticalSigma == null
                && warningDeviationPercent == null && criticalDeviationPercent == null) {
            return null;
        }
        return new SeverityThresholds(
                warningSigma != null ? warningSigma : defaults.getWarningSigma(),
                criticalSigma != null ? criticalSigma : defaults.getCriticalSigma(),
                warningDeviationPercent != null ? warningDeviationPercent : defaults.getWarningDeviationPercent(),
                criticalDeviationPercent != null ? criticalDeviationPercent : defaults.getCriticalDeviationPercent());
    }
}
