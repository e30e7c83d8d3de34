package com.enms.analytics.performance;

import com.enms.analytics.aggregate.AggregateStore;
import com.enms.analytics.aggregate.BucketRow;
import com.enms.analytics.aggregate.FeatureResolver;
import com.enms.analytics.aggregate.QueryPlan;
import com.enms.analytics.aggregate.Resolution;
import com.enms.analytics.config.PerformanceProperties;
import com.enms.analytics.persistence.EnergyReadingRepository;
import com.enms.analytics.persistence.FeatureDefinitionEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Consumption KPIs from raw totals and hourly rollups.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class KpiService {

    private final EnergyReadingRepository readingRepository;
    private final FeatureResolver featureResolver;
    private final AggregateStore aggregateStore;
    private final PerformanceProperties properties;

    public KpiSummary calculate(Collection<String> equipmentIds, String energySource,
                                LocalDateTime from, LocalDateTime to) {
        double hours = Duration.between(from, to).toSeconds() / 3600.0;
        double total = readingRepository.sumValue(equipmentIds, energySource, from, to);

        String target = featureResolver.targetFeature(energySource);
        String production = properties.getProductionFeature();
        boolean hasProduction = featureResolver.listFeatures(energySource).stream()
                .map(FeatureDefinitionEntity::getFeatureName)
                .anyMatch(production::equals);

        List<String> features = new ArrayList<>();
        features.add(target);
        if (hasProduction) {
            features.add(production);
        }
        QueryPlan plan = featureResolver.resolve(energySource, features, Resolution.HOURLY);
        List<BucketRow> rows = aggregateStore.fetch(plan, List.copyOf(equipmentIds), from, to);

        // An hourly bucket's consumption equals its average demand per hour
        Double peak = rows.stream()
                .map(row -> row.get(target))
                .filter(Objects::nonNull)
                .max(Double::compare)
                .orElse(null);
        double average = hours > 0 ? total / hours : 0.0;

        Double productionCount = null;
        if (hasProduction) {
            productionCount = rows.stream()
                    .map(row -> row.get(production))
                    .filter(Objects::nonNull)
                    .reduce(Double::sum)
                    .orElse(null);
        }

        return KpiSummary.builder()
                .energySource(energySource)
                .from(from)
                .to(to)
                .hours(hours)
                .totalConsumption(total)
                .averageDemand(average)
                .peakDemand(peak)
                .loadFactor(peak != null && peak > 0 ? average / peak : null)
                .productionCount(productionCount)
                .specificEnergyConsumption(productionCount != null && productionCount > 0
                        ? total / productionCount : null)
                .energyCost(total * properties.unitCostFor(energySource))
                .carbonEmissionsKg(total * properties.carbonFactorFor(energySource))
                .build();
    }
}
