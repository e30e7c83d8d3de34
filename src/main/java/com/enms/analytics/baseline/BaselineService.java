package com.enms.analytics.baseline;

import com.enms.analytics.aggregate.AggregateStore;
import com.enms.analytics.aggregate.BucketRow;
import com.enms.analytics.aggregate.FeatureResolver;
import com.enms.analytics.aggregate.QueryPlan;
import com.enms.analytics.aggregate.Resolution;
import com.enms.analytics.config.BaselineProperties;
import com.enms.analytics.dto.BaselineModelSummary;
import com.enms.analytics.dto.DeviationResult;
import com.enms.analytics.exception.InsufficientSamplesException;
import com.enms.analytics.exception.InvalidRequestException;
import com.enms.analytics.exception.MissingDriverDataException;
import com.enms.analytics.exception.ResourceNotFoundException;
import com.enms.analytics.persistence.BaselineModelEntity;
import com.enms.analytics.persistence.BaselineModelRepository;
import com.enms.analytics.persistence.EquipmentUnitRepository;
import com.enms.analytics.persistence.ModelTerm;
import com.enms.analytics.persistence.SignificantEnergyUserEntity;
import com.enms.analytics.persistence.SignificantEnergyUserRepository;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Trains, stores and evaluates baseline regression models.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BaselineService {

    private static final Set<QualityTier> USABLE_TIERS =
            EnumSet.of(QualityTier.MEETS_THRESHOLD, QualityTier.ACCEPTABLE);

    private final FeatureResolver featureResolver;
    private final AggregateStore aggregateStore;
    private final BaselineModelRepository modelRepository;
    private final EquipmentUnitRepository equipmentRepository;
    private final SignificantEnergyUserRepository seuRepository;
    private final BaselineProperties properties;

    /**
     * Fit a model on the finest configured resolution with enough complete rows and persist it
     * as the next version. Low-quality models are persisted too, marked {@link QualityTier#LOW_CONFIDENCE}.
     */
    @Transactional
    public BaselineModelSummary train(TrainingRequest request) {
        List<String> equipmentIds = resolveEquipment(request.getTargetType(), request.getTargetId());
        String target = featureResolver.targetFeature(request.getEnergySource());

        List<String> candidates = request.isAutoSelect()
                ? featureResolver.driverFeatures(request.getEnergySource())
                : List.copyOf(request.getFeatures());
        if (candidates.isEmpty()) {
            throw new InvalidRequestException("No driver features registered for " + request.getEnergySource());
        }

        log.info("Training baseline for {} {} ({}) over {} - {} with {} features{}",
                request.getTargetType(), request.getTargetId(), request.getEnergySource(),
                request.getFrom(), request.getTo(), candidates.size(), request.isAutoSelect() ? " (auto)" : "");

        Candidate best = null;
        int bestSampleCount = 0;
        for (Resolution resolution : properties.getTrainingResolutions()) {
            List<String> columns = new ArrayList<>();
            columns.add(target);
            columns.addAll(candidates);
            QueryPlan plan = featureResolver.resolve(request.getEnergySource(), columns, resolution);
            List<BucketRow> rows = aggregateStore.fetch(plan, equipmentIds, request.getFrom(), request.getTo())
                    .stream()
                    .filter(row -> row.get(target) != null)
                    .toList();

            if (rows.isEmpty()) {
                log.debug("No {} rows for {} in training window", resolution, request.getTargetId());
                continue;
            }

            List<String> available = new ArrayList<>();
            for (String feature : candidates) {
                if (rows.stream().anyMatch(row -> row.get(feature) != null)) {
                    available.add(feature);
                } else if (!request.isAutoSelect()) {
                    throw new MissingDriverDataException(feature);
                } else {
                    log.debug("Dropping auto-select candidate {}: no values at {}", feature, resolution);
                }
            }

            Candidate candidate = request.isAutoSelect()
                    ? selectBestSubset(target, available, rows, resolution)
                    : fitSubset(target, available, rows, resolution);
            if (candidate != null) {
                best = candidate;
                break;
            }

            int complete = (int) rows.stream().filter(row -> row.hasAll(available)).count();
            bestSampleCount = Math.max(bestSampleCount, complete);
            log.debug("Resolution {} has {} complete rows, trying coarser", resolution, complete);
        }

        if (best == null) {
            int required = properties.requiredSamples(request.isAutoSelect() ? 1 : candidates.size());
            throw new InsufficientSamplesException(bestSampleCount, required);
        }

        BaselineModelEntity saved = persist(request, best);
        log.info("Stored baseline v{} for {} {}: R²={}, RMSE={}, n={}, tier={}",
                saved.getVersion(), saved.getTargetType(), saved.getTargetId(),
                String.format("%.4f", saved.getRSquared()), String.format("%.3f", saved.getRmse()),
                saved.getSampleCount(), saved.getQualityTier());
        if (!saved.getQualityTier().isUsable()) {
            log.warn("Baseline v{} for {} is low confidence (R²={}) and will not be used for deviation",
                    saved.getVersion(), saved.getTargetId(), String.format("%.4f", saved.getRSquared()));
        }
        return BaselineModelSummary.from(saved);
    }

    private Candidate selectBestSubset(String target, List<String> available,
                                       List<BucketRow> rows, Resolution resolution) {
        int maxSize = Math.min(properties.getAutoSelect().getMaxFeatures(), available.size());
        Candidate best = null;
        for (int size = 1; size <= maxSize; size++) {
            for (Set<String> subset : Sets.combinations(ImmutableSet.copyOf(available), size)) {
                Candidate candidate = fitSubset(target, List.copyOf(subset), rows, resolution);
                if (candidate != null && (best == null
                        || candidate.fit().adjustedRSquared() > best.fit().adjustedRSquared())) {
                    best = candidate;
                }
            }
        }
        if (best != null) {
            log.info("Auto-selected features {} (adjusted R²={})", best.features(),
                    String.format("%.4f", best.fit().adjustedRSquared()));
        }
        return best;
    }

    private Candidate fitSubset(String target, List<String> features,
                                List<BucketRow> rows, Resolution resolution) {
        List<BucketRow> complete = rows.stream().filter(row -> row.hasAll(features)).toList();
        if (complete.size() < properties.requiredSamples(features.size())) {
            return null;
        }

        double[][] x = new double[complete.size()][];
        double[] y = new double[complete.size()];
        for (int i = 0; i < complete.size(); i++) {
            x[i] = complete.get(i).toArray(features);
            y[i] = complete.get(i).get(target);
        }

        try {
            BaselineRegression.FittedModel fit = BaselineRegression.fit(x, y);
            return new Candidate(features, fit, resolution,
                    complete.get(0).getBucketStart(), complete.get(complete.size() - 1).getBucketStart());
        } catch (MathIllegalArgumentException e) {
            log.warn("Cannot fit features {} at {}: {}", features, resolution, e.getMessage());
            return null;
        }
    }

    private BaselineModelEntity persist(TrainingRequest request, Candidate candidate) {
        int version = modelRepository.findMaxVersion(
                request.getTargetType(), request.getTargetId(), request.getEnergySource()) + 1;

        List<ModelTerm> terms = new ArrayList<>();
        for (int i = 0; i < candidate.features().size(); i++) {
            terms.add(new ModelTerm(candidate.features().get(i), candidate.fit().coefficients()[i]));
        }

        BaselineModelEntity entity = BaselineModelEntity.builder()
                .targetType(request.getTargetType())
                .targetId(request.getTargetId())
                .energySource(request.getEnergySource())
                .version(version)
                .terms(terms)
                .intercept(candidate.fit().intercept())
                .rSquared(candidate.fit().rSquared())
                .rmse(candidate.fit().rmse())
                .mae(candidate.fit().mae())
                .qualityTier(QualityTier.of(candidate.fit().rSquared(),
                        properties.getGoodR2(), properties.getAcceptableR2()))
                .resolution(candidate.resolution())
                .trainingStart(candidate.firstBucket())
                .trainingEnd(candidate.lastBucket())
                .sampleCount(candidate.fit().sampleCount())
                .autoSelected(request.isAutoSelect())
                .build();
        return modelRepository.save(entity);
    }

    public List<BaselineModelSummary> listModels(TargetType targetType, String targetId) {
        return modelRepository.findByTargetTypeAndTargetIdOrderByEnergySourceAscVersionDesc(targetType, targetId)
                .stream()
                .map(BaselineModelSummary::from)
                .toList();
    }

    /**
     * A specific version, or the latest usable one when {@code version} is null.
     */
    public BaselineModelEntity getModel(TargetType targetType, String targetId, String energySource, Integer version) {
        if (version != null) {
            return modelRepository.findByTargetTypeAndTargetIdAndEnergySourceAndVersion(
                            targetType, targetId, energySource, version)
                    .orElseThrow(() -> new ResourceNotFoundException(
                            "Baseline v" + version + " not found for " + targetType + " " + targetId));
        }
        return findLatestUsable(targetType, targetId, energySource)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No usable baseline for " + targetType + " " + targetId + " (" + energySource + ")"));
    }

    public Optional<BaselineModelEntity> findLatestUsable(TargetType targetType, String targetId,
                                                                   String energySource) {
        return modelRepository.findTopByTargetTypeAndTargetIdAndEnergySourceAndQualityTierInOrderByVersionDesc(
                targetType, targetId, energySource, USABLE_TIERS);
    }

    public double predict(BaselineModelEntity model, Map<String, Double> featureValues) {
        List<String> names = model.getFeatureNames();
        double[] values = new double[names.size()];
        for (int i = 0; i < names.size(); i++) {
            Double value = featureValues.get(names.get(i));
            if (value == null) {
                throw new InvalidRequestException("Missing value for feature " + names.get(i));
            }
            values[i] = value;
        }
        return BaselineRegression.predict(model.getIntercept(), model.getCoefficients(), values);
    }

    public DeviationResult deviation(BaselineModelEntity model, double actual, Map<String, Double> featureValues) {
        double expected = predict(model, featureValues);
        return DeviationResult.builder()
                .modelVersion(model.getVersion())
                .expected(expected)
                .actual(actual)
                .deviation(actual - expected)
                .deviationPercent(deviationPercent(actual, expected))
                .build();
    }

    /**
     * Expected full-day consumption: mean bucket prediction over the period's driver rows
     * scaled to a whole day at the model's resolution. Empty when no complete driver row exists.
     * A bucket only partly inside {@code [from, to)} has its accumulating drivers scaled up to the
     * full bucket, so a day in progress is predicted on the same full-day basis as its projection.
     */
    public OptionalDouble expectedDailyConsumption(BaselineModelEntity model, List<String> equipmentIds,
                                                   LocalDateTime from, LocalDateTime to) {
        List<String> features = model.getFeatureNames();
        Resolution resolution = model.getResolution();
        QueryPlan plan = featureResolver.resolve(model.getEnergySource(), features, resolution);
        Set<String> additive = featureResolver.additiveFeatures(model.getEnergySource(), features);

        double widthSeconds = resolution.getWidth().getSeconds();
        List<Double> predictions = new ArrayList<>();
        for (BucketRow row : aggregateStore.fetch(plan, equipmentIds, from, to)) {
            if (!row.hasAll(features)) {
                continue;
            }
            LocalDateTime bucketEnd = row.getBucketStart().plus(resolution.getWidth());
            LocalDateTime coveredStart = row.getBucketStart().isBefore(from) ? from : row.getBucketStart();
            LocalDateTime coveredEnd = bucketEnd.isAfter(to) ? to : bucketEnd;
            double coverage = Duration.between(coveredStart, coveredEnd).getSeconds() / widthSeconds;
            if (coverage <= 0.0) {
                continue;
            }

            double[] values = row.toArray(features);
            if (coverage < 1.0) {
                for (int i = 0; i < features.size(); i++) {
                    if (additive.contains(features.get(i))) {
                        values[i] = values[i] / coverage;
                    }
                }
                log.debug("Bucket {} is {}% observed, scaled drivers {} to the full bucket",
                        row.getBucketStart(), String.format("%.0f", coverage * 100), additive);
            }
            predictions.add(BaselineRegression.predict(model.getIntercept(), model.getCoefficients(), values));
        }
        if (predictions.isEmpty()) {
            return OptionalDouble.empty();
        }

        double meanPrediction = predictions.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return OptionalDouble.of(meanPrediction * resolution.bucketsPerDay());
    }

    /**
     * Signed percentage, positive for over-consumption; null when nothing was expected.
     */
    public static Double deviationPercent(double actual, double expected) {
        if (expected == 0.0) {
            return null;
        }
        return (actual - expected) / expected * 100.0;
    }

    public List<String> resolveEquipment(TargetType targetType, String targetId) {
        if (targetType == TargetType.SEU) {
            SignificantEnergyUserEntity seu = seuRepository.findByNameIgnoreCase(targetId)
                    .orElseThrow(() -> new ResourceNotFoundException("SEU not found: " + targetId));
            if (seu.getEquipmentIds().isEmpty()) {
                throw new InvalidRequestException("SEU " + targetId + " has no equipment units");
            }
            return List.copyOf(seu.getEquipmentIds());
        }
        if (!equipmentRepository.existsById(targetId)) {
            throw new ResourceNotFoundException("Equipment unit not found: " + targetId);
        }
        return List.of(targetId);
    }

    private record Candidate(List<String> features, BaselineRegression.FittedModel fit, Resolution resolution,
                             LocalDateTime firstBucket, LocalDateTime lastBucket) {
    }
}
