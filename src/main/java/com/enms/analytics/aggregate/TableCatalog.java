package com.enms.analytics.aggregate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Answers whether a rollup table has been provisioned in the store.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TableCatalog {

    private final JdbcTemplate jdbcTemplate;

    // Only positive answers are cached: a missing table may be provisioned later
    private final Set<String> knownTables = ConcurrentHashMap.newKeySet();

    public boolean exists(String table) {
        String key = table.toLowerCase(Locale.ROOT);
        if (knownTables.contains(key)) {
            return true;
        }

        Boolean found = jdbcTemplate.execute((ConnectionCallback<Boolean>) connection -> {
            DatabaseMetaData metaData = connection.getMetaData();
            return hasTable(metaData, key) || hasTable(metaData, key.toUpperCase(Locale.ROOT));
        });

        if (Boolean.TRUE.equals(found)) {
            knownTables.add(key);
            return true;
        }
        log.debug("Table {} not found in store", table);
        return false;
    }

    private boolean hasTable(DatabaseMetaData metaData, String name) throws SQLException {
        try (ResultSet rs = metaData.getTables(null, null, name, new String[]{"TABLE", "VIEW", "MATERIALIZED VIEW"})) {
            return rs.next();
        }
    }
}
