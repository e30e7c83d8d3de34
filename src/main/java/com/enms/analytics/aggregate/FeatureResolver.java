package com.enms.analytics.aggregate;

import com.enms.analytics.exception.NoAggregateTableException;
import com.enms.analytics.exception.UnknownFeatureException;
import com.enms.analytics.persistence.FeatureDefinitionEntity;
import com.enms.analytics.persistence.FeatureDefinitionRepository;
import com.google.common.base.Preconditions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps driver names to the rollup table, column and aggregation that compute them,
 * using the feature registry. No feature is known to the code itself.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FeatureResolver {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z][a-z0-9_]{0,62}");

    private final FeatureDefinitionRepository featureRepository;
    private final TableCatalog tableCatalog;

    /**
     * Build a query plan for the given features at one resolution.
     *
     * @throws UnknownFeatureException   if a name has no active registry entry for the source
     * @throws NoAggregateTableException if a referenced rollup table is not provisioned
     */
    public QueryPlan resolve(String energySource, List<String> featureNames, Resolution resolution) {
        Preconditions.checkArgument(featureNames != null && !featureNames.isEmpty(),
                "At least one feature is required");

        Map<String, List<FeatureColumn>> columnsByTable = new LinkedHashMap<>();
        for (String featureName : featureNames) {
            FeatureDefinitionEntity definition = lookup(energySource, featureName);
            String table = resolution.tableName(requireIdentifier(definition.getSourceTable()));
            String column = requireIdentifier(definition.getSourceColumn());

            if (!tableCatalog.exists(table)) {
                throw new NoAggregateTableException(table, featureName);
            }

            String expression = definition.getAggregationFunction()
                    .toSql(column, definition.getCustomExpression());
            columnsByTable.computeIfAbsent(table, t -> new ArrayList<>())
                    .add(new FeatureColumn(featureName, expression));
        }

        List<TableQuery> tableQueries = new ArrayList<>();
        columnsByTable.forEach((table, columns) -> tableQueries.add(new TableQuery(table, columns)));

        log.debug("Resolved {} features for {} at {} into {} table queries",
                featureNames.size(), energySource, resolution, tableQueries.size());

        return QueryPlan.builder()
                .energySource(energySource)
                .resolution(resolution)
                .featureNames(List.copyOf(featureNames))
                .tableQueries(tableQueries)
                .build();
    }

    /**
     * The consumption feature baselines predict for an energy source.
     */
    public String targetFeature(String energySource) {
        List<FeatureDefinitionEntity> targets = featureRepository
                .findByEnergySourceAndRoleAndActiveTrueOrderByFeatureName(energySource, FeatureRole.TARGET);
        if (targets.isEmpty()) {
            throw new UnknownFeatureException(energySource, "<consumption target>");
        }
        if (targets.size() > 1) {
            log.warn("Energy source {} has {} target features, using {}",
                    energySource, targets.size(), targets.get(0).getFeatureName());
        }
        return targets.get(0).getFeatureName();
    }

    /**
     * Registered regression drivers, the candidate superset for automatic selection.
     */
    public List<String> driverFeatures(String energySource) {
        return featureRepository
                .findByEnergySourceAndRoleAndActiveTrueOrderByFeatureName(energySource, FeatureRole.DRIVER)
                .stream()
                .map(FeatureDefinitionEntity::getFeatureName)
                .toList();
    }

    /**
     * The subset of {@code featureNames} whose values accumulate over a bucket.
     */
    public Set<String> additiveFeatures(String energySource, List<String> featureNames) {
        Set<String> additive = new HashSet<>();
        for (String featureName : featureNames) {
            FeatureDefinitionEntity definition = lookup(energySource, featureName);
            if (definition.getAggregationFunction().isAdditive(definition.getCustomExpression())) {
                additive.add(featureName);
            }
        }
        return additive;
    }

    public List<FeatureDefinitionEntity> listFeatures(String energySource) {
        return featureRepository.findByEnergySourceAndActiveTrueOrderByFeatureName(energySource);
    }

    private FeatureDefinitionEntity lookup(String energySource, String featureName) {
        return featureRepository.findByEnergySourceAndFeatureNameAndActiveTrue(energySource, featureName)
                .orElseThrow(() -> new UnknownFeatureException(energySource, featureName));
    }

    private String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalStateException("Invalid identifier in feature registry: " + name);
        }
        return name;
    }
}
