package com.enms.analytics.aggregate;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Resolved way of computing a list of named features at one resolution.
 * Results of the individual table queries are joined on bucket start.
 */
@Getter
@Builder
public class QueryPlan {

    private final String energySource;
    private final Resolution resolution;
    private final List<String> featureNames;
    private final List<TableQuery> tableQueries;
}
