package com.enms.analytics.aggregate;

import com.enms.analytics.persistence.EnergyReadingEntity;
import com.enms.analytics.persistence.EnergyReadingRepository;
import com.enms.analytics.persistence.ReadingRollup;
import io.github.resilience4j.retry.Retry;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read view over the rollup tables plus the refresh that rebuilds them.
 * A rollup is always rebuilt from raw readings, never from another rollup.
 */
@Service
@Slf4j
public class AggregateStore {

    private final JdbcTemplate jdbcTemplate;
    private final EnergyReadingRepository readingRepository;
    private final FeatureResolver featureResolver;
    private final Retry storeReadRetry;
    private final Clock clock;

    @PersistenceContext
    private EntityManager entityManager;

    public AggregateStore(JdbcTemplate jdbcTemplate,
                          EnergyReadingRepository readingRepository,
                          FeatureResolver featureResolver,
                          Retry storeReadRetry,
                          Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.readingRepository = readingRepository;
        this.featureResolver = featureResolver;
        this.storeReadRetry = storeReadRetry;
        this.clock = clock;
    }

    /**
     * Execute a plan for a set of equipment units, joining the per-table results on bucket start.
     * Buckets missing from one table keep null values for that table's features.
     */
    public List<BucketRow> fetch(QueryPlan plan, Collection<String> equipmentIds,
                                 LocalDateTime from, LocalDateTime to) {
        if (equipmentIds.isEmpty()) {
            return List.of();
        }

        Map<LocalDateTime, BucketRow> rows = new TreeMap<>();
        for (TableQuery query : plan.getTableQueries()) {
            List<Object> args = new ArrayList<>();
            args.add(plan.getEnergySource());
            args.addAll(equipmentIds);
            args.add(Timestamp.valueOf(from));
            args.add(Timestamp.valueOf(to));

            String sql = query.toSql(equipmentIds.size());
            storeReadRetry.executeRunnable(() ->
                    jdbcTemplate.query(sql, rs -> {
                        LocalDateTime bucket = rs.getTimestamp(1).toLocalDateTime();
                        BucketRow row = rows.computeIfAbsent(bucket, BucketRow::new);
                        for (int i = 0; i < query.columns().size(); i++) {
                            row.put(query.columns().get(i).featureName(), readDouble(rs, i + 2));
                        }
                    }, args.toArray()));
        }

        // Align every row on the plan's feature order
        List<BucketRow> result = new ArrayList<>(rows.size());
        for (BucketRow row : rows.values()) {
            BucketRow aligned = new BucketRow(row.getBucketStart());
            for (String feature : plan.getFeatureNames()) {
                aligned.put(feature, row.get(feature));
            }
            result.add(aligned);
        }
        return result;
    }

    /**
     * Bucketed series of named features for one equipment unit.
     */
    public List<BucketRow> getSeries(String equipmentId, String energySource, Resolution resolution,
                                     List<String> featureNames, LocalDateTime from, LocalDateTime to) {
        QueryPlan plan = featureResolver.resolve(energySource, featureNames, resolution);
        return fetch(plan, List.of(equipmentId), from, to);
    }

    /**
     * Rebuild one resolution's rollups covering [from, to) from raw readings.
     * Re-running over the same window produces the same rows.
     *
     * @return number of rollup rows written
     */
    @Transactional
    public int refresh(Resolution resolution, LocalDateTime from, LocalDateTime to) {
        LocalDateTime start = resolution.bucketStart(from);
        LocalDateTime end = resolution.bucketStart(to);
        if (end.isBefore(to)) {
            end = end.plus(resolution.getWidth());
        }

        List<EnergyReadingEntity> readings = readingRepository.findReadingsBetween(start, end);

        int deleted = entityManager.createQuery(
                        "DELETE FROM " + resolution.getEntityClass().getSimpleName()
                                + " r WHERE r.bucketStart >= :from AND r.bucketStart < :to")
                .setParameter("from", start)
                .setParameter("to", end)
                .executeUpdate();

        Map<RollupKey, List<EnergyReadingEntity>> groups = readings.stream()
                .collect(Collectors.groupingBy(r -> new RollupKey(
                        r.getEquipmentId(), r.getEnergyType(), resolution.bucketStart(r.getTime()))));

        LocalDateTime refreshedAt = LocalDateTime.now(clock);
        for (Map.Entry<RollupKey, List<EnergyReadingEntity>> entry : groups.entrySet()) {
            entityManager.persist(buildRollup(resolution, entry.getKey(), entry.getValue(), refreshedAt));
        }

        log.info("Refreshed {} rollups {} - {}: {} readings -> {} rows (replaced {})",
                resolution, start, end, readings.size(), groups.size(), deleted);
        return groups.size();
    }

    private ReadingRollup buildRollup(Resolution resolution, RollupKey key,
                                      List<EnergyReadingEntity> readings, LocalDateTime refreshedAt) {
        ReadingRollup row = resolution.newRow();
        row.setEquipmentId(key.equipmentId());
        row.setEnergyType(key.energyType());
        row.setBucketStart(key.bucketStart());
        row.setTotalValue(readings.stream().mapToDouble(EnergyReadingEntity::getValue).sum());
        row.setAvgPowerKw(average(readings.stream().map(EnergyReadingEntity::getPowerKw).toList()));
        row.setMaxPowerKw(readings.stream().map(EnergyReadingEntity::getPowerKw)
                .filter(Objects::nonNull).max(Double::compare).orElse(null));
        row.setProductionCount(sum(readings.stream().map(EnergyReadingEntity::getProductionCount).toList()));
        row.setAvgOutdoorTempC(average(readings.stream().map(EnergyReadingEntity::getOutdoorTempC).toList()));
        row.setAvgPressureBar(average(readings.stream().map(EnergyReadingEntity::getPressureBar).toList()));
        row.setAvgLoadFactor(average(readings.stream().map(EnergyReadingEntity::getLoadFactor).toList()));
        row.setReadingCount(readings.size());
        row.setRefreshedAt(refreshedAt);
        return row;
    }

    private static Double average(List<Double> values) {
        List<Double> present = values.stream().filter(Objects::nonNull).toList();
        if (present.isEmpty()) {
            return null;
        }
        return present.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static Double sum(List<Double> values) {
        List<Double> present = values.stream().filter(Objects::nonNull).toList();
        if (present.isEmpty()) {
            return null;
        }
        return present.stream().mapToDouble(Double::doubleValue).sum();
    }

    private static Double readDouble(ResultSet rs, int index) throws SQLException {
        double value = rs.getDouble(index);
        return rs.wasNull() ? null : value;
    }

    private record RollupKey(String equipmentId, String energyType, LocalDateTime bucketStart) {
    }
}
