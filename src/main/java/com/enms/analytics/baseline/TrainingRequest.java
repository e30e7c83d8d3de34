package com.enms.analytics.baseline;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Training input. An empty feature list means automatic selection.
 */
@Data
@Builder
public class TrainingRequest {

    private TargetType targetType;
    private String targetId;
    private String energySource;
    private LocalDateTime from;
    private LocalDateTime to;
    private List<String> features;
    private String triggerReason;

    public boolean isAutoSelect() {
        return features == null || features.isEmpty();
    }
}
