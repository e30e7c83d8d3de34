package com.enms.analytics.aggregate;

import com.enms.analytics.BaseIntegrationTest;
import com.enms.analytics.persistence.EnergyReadingEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AggregateStore Tests")
class AggregateStoreTest extends BaseIntegrationTest {

    private static final LocalDateTime DAY = LocalDateTime.of(2025, 3, 10, 0, 0);

    @Autowired
    private FeatureResolver featureResolver;

    @BeforeEach
    void setUp() {
        // Two units, one reading every 15 minutes for two hours
        List<EnergyReadingEntity> readings = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            LocalDateTime time = DAY.plusMinutes(15L * i);
            EnergyReadingEntity a = reading("compressor-1", time, 10.0);
            a.setPowerKw(40.0 + i);
            a.setProductionCount(5.0);
            a.setOutdoorTempC(8.0);
            readings.add(a);

            EnergyReadingEntity b = reading("compressor-2", time, 2.5);
            b.setPowerKw(10.0);
            readings.add(b);
        }
        readingRepository.saveAll(readings);
    }

    @Nested
    @DisplayName("Refresh")
    class RefreshTests {

        @Test
        @DisplayName("Rebuilds hourly rollups from raw readings")
        void buildsHourlyRollups() {
            int rows = aggregateStore.refresh(Resolution.HOURLY, DAY, DAY.plusHours(2));

            assertEquals(4, rows);
            Double total = jdbcTemplate.queryForObject(
                    "SELECT total_value FROM energy_readings_1h WHERE equipment_id = ? AND bucket_start = ?",
                    Double.class, "compressor-1", DAY);
            Double maxPower = jdbcTemplate.queryForObject(
                    "SELECT max_power_kw FROM energy_readings_1h WHERE equipment_id = ? AND bucket_start = ?",
                    Double.class, "compressor-1", DAY.plusHours(1));
            assertEquals(40.0, total);
            assertEquals(47.0, maxPower);
        }

        @Test
        @DisplayName("Re-running the same window replaces rather than duplicates")
        void idempotent() {
            aggregateStore.refresh(Resolution.FIFTEEN_MINUTES, DAY, DAY.plusHours(2));
            aggregateStore.refresh(Resolution.FIFTEEN_MINUTES, DAY, DAY.plusHours(2));

            Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM energy_readings_15m", Integer.class);
            assertEquals(16, count);
        }

        @Test
        @DisplayName("Window is widened to whole buckets")
        void alignsToBuckets() {
            aggregateStore.refresh(Resolution.DAILY, DAY.plusHours(1), DAY.plusHours(1).plusMinutes(5));

            Double total = jdbcTemplate.queryForObject(
                    "SELECT total_value FROM energy_readings_1d WHERE equipment_id = ?", Double.class, "compressor-1");
            assertEquals(80.0, total);
        }
    }

    @Nested
    @DisplayName("Fetch")
    class FetchTests {

        @BeforeEach
        void refreshHourly() {
            refresh(Resolution.HOURLY, DAY, DAY.plusHours(2));
        }

        @Test
        @DisplayName("Aggregates across the units of a group per bucket")
        void aggregatesAcrossUnits() {
            QueryPlan plan = featureResolver.resolve("electricity",
                    List.of("consumption_kwh", "peak_power_kw"), Resolution.HOURLY);

            List<BucketRow> rows = aggregateStore.fetch(plan, List.of("compressor-1", "compressor-2"),
                    DAY, DAY.plusHours(2));

            assertEquals(2, rows.size());
            assertEquals(DAY, rows.get(0).getBucketStart());
            assertEquals(50.0, rows.get(0).get("consumption_kwh"));
            assertEquals(43.0, rows.get(0).get("peak_power_kw"));
        }

        @Test
        @DisplayName("Missing driver values come back as null, not zero")
        void missingValuesAreNull() {
            List<BucketRow> rows = aggregateStore.getSeries("compressor-2", "electricity", Resolution.HOURLY,
                    List.of("consumption_kwh", "outdoor_temp_c"), DAY, DAY.plusHours(2));

            assertEquals(2, rows.size());
            assertEquals(10.0, rows.get(1).get("consumption_kwh"));
            assertNull(rows.get(1).get("outdoor_temp_c"));
            assertThat(rows.get(1).hasAll(List.of("consumption_kwh", "outdoor_temp_c"))).isFalse();
        }

        @Test
        @DisplayName("Custom aggregation expressions are evaluated by the store")
        void customExpression() {
            List<BucketRow> rows = aggregateStore.getSeries("compressor-1", "electricity", Resolution.HOURLY,
                    List.of("heating_degree_hours"), DAY, DAY.plusHours(1));

            assertEquals(1, rows.size());
            assertEquals(10.0, rows.get(0).get("heating_degree_hours"));
        }

        @Test
        @DisplayName("An empty unit list returns no rows")
        void emptyUnits() {
            QueryPlan plan = featureResolver.resolve("electricity", List.of("consumption_kwh"), Resolution.HOURLY);

            assertTrue(aggregateStore.fetch(plan, List.of(), DAY, DAY.plusHours(2)).isEmpty());
        }
    }
}
