package com.enms.analytics.performance;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Composite performance report of one SEU for one day. Recomputed on every request.
 * Baseline-dependent fields are null when no baseline exists.
 */
@Data
@Builder
public class PerformanceAnalysis {

    private String seuName;
    private String energySource;
    private LocalDate date;

    /** Full-day equivalent consumption; the raw sum for a completed day. */
    private double actualEnergy;

    /** Consumption observed so far. */
    private double actualRaw;

    private double hoursElapsed;
    private boolean projection;

    private Double baselineEnergy;
    private BaselineSource baselineSource;
    private Integer baselineModelVersion;

    private Double deviation;
    private Double deviationPercent;
    private Double deviationCost;
    private Double efficiencyScore;

    private RootCauseAnalysis rootCause;
    private List<Recommendation> recommendations;
    private ComplianceStatus complianceStatus;

    private int anomalyCount;
    private int criticalAnomalyCount;

    /** Null when KPI computation failed; the rest of the report is unaffected. */
    private KpiSummary kpis;

    private String voiceSummary;
    private Instant timestamp;
}
