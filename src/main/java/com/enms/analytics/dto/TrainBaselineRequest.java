package com.enms.analytics.dto;

import com.enms.analytics.baseline.TargetType;
import com.enms.analytics.baseline.TrainingRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Training request body. Omit {@code features} to let the drivers be selected automatically.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainBaselineRequest {

    @NotNull(message = "Target type is required")
    private TargetType targetType;

    @NotBlank(message = "Target id is required")
    private String targetId;

    @NotBlank(message = "Energy source is required")
    private String energySource;

    @NotNull(message = "Training start is required")
    private LocalDateTime from;

    @NotNull(message = "Training end is required")
    private LocalDateTime to;

    private List<String> features;

    public TrainingRequest toTrainingRequest(String triggerReason) {
        return TrainingRequest.builder()
                .targetType(targetType)
                .targetId(targetId)
                .energySource(energySource)
                .from(from)
                .to(to)
                .features(features)
                .triggerReason(triggerReason)
                .build();
    }
}
