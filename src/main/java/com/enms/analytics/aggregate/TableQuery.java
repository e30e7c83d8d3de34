package com.enms.analytics.aggregate;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * All features of a plan that are served by the same physical rollup table.
 */
public record TableQuery(String table, List<FeatureColumn> columns) {

    /**
     * Grouped select over the table for a set of equipment units. Parameters, in order:
     * energy type, each equipment id, bucket range start (inclusive), end (exclusive).
     */
    public String toSql(int equipmentCount) {
        String select = columns.stream()
                .map(FeatureColumn::expression)
                .collect(Collectors.joining(", "));
        String placeholders = String.join(", ", Collections.nCopies(equipmentCount, "?"));
        return "SELECT bucket_start, " + select
                + " FROM " + table
                + " WHERE energy_type = ? AND equipment_id IN (" + placeholders + ")"
                + " AND bucket_start >= ? AND bucket_start < ?"
                + " GROUP BY bucket_start ORDER BY bucket_start";
    }
}
