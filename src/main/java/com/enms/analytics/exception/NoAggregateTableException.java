package com.enms.analytics.exception;

import lombok.Getter;

@Getter
public class NoAggregateTableException extends AnalyticsException {

    private final String tableName;

    public NoAggregateTableException(String tableName, String featureName) {
        super(ErrorKind.NO_AGGREGATE_TABLE,
                "Aggregate table '" + tableName + "' required by feature '" + featureName
                        + "' has not been provisioned");
        this.tableName = tableName;
    }
}
