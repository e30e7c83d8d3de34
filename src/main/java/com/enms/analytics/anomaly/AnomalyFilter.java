package com.enms.analytics.anomaly;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Optional criteria for anomaly queries. Null fields do not restrict.
 */
@Data
@Builder
public class AnomalyFilter {

    private String equipmentId;
    private Severity severity;
    private Boolean resolved;
    private LocalDateTime from;
    private LocalDateTime to;

    @Builder.Default
    private int limit = 100;
}
