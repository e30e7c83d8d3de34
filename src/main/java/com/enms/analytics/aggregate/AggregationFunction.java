package com.enms.analytics.aggregate;

import java.util.Locale;

/**
 * How a feature column is combined across rollup rows (equipment units of an SEU
 * sharing one bucket).
 */
public enum AggregationFunction {
    SUM,
    AVG,
    MIN,
    MAX,
    CUSTOM;

    /**
     * SQL aggregate expression for the given column.
     *
     * @param column           validated column name
     * @param customExpression expression used when this is CUSTOM, with {@code {column}} placeholder
     */
    public String toSql(String column, String customExpression) {
        if (this == CUSTOM) {
            if (customExpression == null || !customExpression.contains("{column}")) {
                throw new IllegalStateException("CUSTOM aggregation requires an expression with a {column} placeholder");
            }
            return customExpression.replace("{column}", column);
        }
        return name() + "(" + column + ")";
    }

    /**
     * Whether the feature accumulates over time within a bucket, so a partly elapsed bucket
     * holds only a share of its full value. CUSTOM expressions count when they are an outer SUM.
     */
    public boolean isAdditive(String customExpression) {
        if (this == CUSTOM) {
            return customExpression != null
                    && customExpression.trim().toUpperCase(Locale.ROOT).startsWith("SUM(");
        }
        return this == SUM;
    }
}
