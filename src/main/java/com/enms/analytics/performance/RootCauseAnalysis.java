package com.enms.analytics.performance;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class RootCauseAnalysis {

    private RootCause primaryFactor;
    private String impactDescription;
    private List<String> contributingFactors;

    /** 0 to 1; lowered for projections and weaker baselines. */
    private double confidence;
}
