package com.enms.analytics.performance;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class Recommendation {

    private String action;

    /** operational, maintenance or capital */
    private String type;

    private double estimatedSavings;
    private double estimatedSavingsCost;
    private ImplementationEffort effort;
    private RecommendationPriority priority;
    private int expectedPaybackDays;
    private List<String> steps;
}
