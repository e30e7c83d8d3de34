package com.enms.analytics.anomaly;

import com.enms.analytics.aggregate.AggregateStore;
import com.enms.analytics.aggregate.BucketRow;
import com.enms.analytics.aggregate.FeatureResolver;
import com.enms.analytics.aggregate.Resolution;
import com.enms.analytics.baseline.BaselineRegression;
import com.enms.analytics.baseline.BaselineService;
import com.enms.analytics.baseline.TargetType;
import com.enms.analytics.config.DetectionProperties;
import com.enms.analytics.event.EnergyEventPublisher;
import com.enms.analytics.event.EventTopic;
import com.enms.analytics.exception.InvalidRequestException;
import com.enms.analytics.exception.ResourceNotFoundException;
import com.enms.analytics.persistence.AnomalyEntity;
import com.enms.analytics.persistence.AnomalyRepository;
import com.enms.analytics.persistence.BaselineModelEntity;
import com.enms.analytics.persistence.EquipmentUnitRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs both anomaly checks for an equipment unit and stores findings with upsert semantics
 * on {@code (equipment_id, detected_at, metric)}.
 */
@Service
@Slf4j
public class AnomalyService {

    private static final String MODEL_METRIC_SUFFIX = "_vs_baseline";

    private final AggregateStore aggregateStore;
    private final FeatureResolver featureResolver;
    private final BaselineService baselineService;
    private final AnomalyRepository anomalyRepository;
    private final EquipmentUnitRepository equipmentRepository;
    private final EnergyEventPublisher eventPublisher;
    private final DetectionProperties properties;
    private final AnomalyDetector detector;
    private final Clock clock;

    public AnomalyService(AggregateStore aggregateStore,
                          FeatureResolver featureResolver,
                          BaselineService baselineService,
                          AnomalyRepository anomalyRepository,
                          EquipmentUnitRepository equipmentRepository,
                          EnergyEventPublisher eventPublisher,
                          DetectionProperties properties,
                          Clock clock) {
        this.aggregateStore = aggregateStore;
        this.featureResolver = featureResolver;
        this.baselineService = baselineService;
        this.anomalyRepository = anomalyRepository;
        this.equipmentRepository = equipmentRepository;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.detector = new AnomalyDetector(properties.getRollingWindow(), properties.getMinWindow());
        this.clock = clock;
    }

    /**
     * Detect over [from, to) and return every anomaly stored for the unit in that window.
     * Re-running over the same window returns the same set without creating rows.
     */
    public List<AnomalyEntity> detectAnomalies(String equipmentId, String energySource,
                                               LocalDateTime from, LocalDateTime to,
                                               SeverityThresholds thresholds) {
        if (!from.isBefore(to)) {
            throw new InvalidRequestException("Detection window start must be before its end");
        }
        if (!equipmentRepository.existsById(equipmentId)) {
            throw new ResourceNotFoundException("Equipment unit not found: " + equipmentId);
        }
        SeverityThresholds effective = thresholds != null ? thresholds : SeverityThresholds.from(properties);

        Resolution resolution = properties.getResolution();
        String target = featureResolver.targetFeature(energySource);
        LocalDateTime lookback = from.minus(resolution.getWidth().multipliedBy(properties.getRollingWindow()));

        List<SeriesPoint> series = new ArrayList<>();
        for (BucketRow row : aggregateStore.getSeries(equipmentId, energySource, resolution,
                List.of(target), lookback, to)) {
            Double observed = row.get(target);
            if (observed != null) {
                series.add(new SeriesPoint(row.getBucketStart(), observed, null));
            }
        }

        List<AnomalyFinding> statistical = detector.detectStatistical(series, from, effective);
        List<AnomalyFinding> modelBased = detectAgainstBaseline(equipmentId, energySource, resolution,
                series, from, to, effective);

        int created = 0;
        created += store(equipmentId, energySource, target, statistical);
        created += store(equipmentId, energySource, target + MODEL_METRIC_SUFFIX, modelBased);

        log.info("Anomaly detection for {} ({}) {} - {}: {} statistical, {} model findings, {} new",
                equipmentId, energySource, from, to, statistical.size(), modelBased.size(), created);

        return anomalyRepository.findForEquipmentBetween(List.of(equipmentId), from, to);
    }

    private List<AnomalyFinding> detectAgainstBaseline(String equipmentId, String energySource,
                                                       Resolution resolution, List<SeriesPoint> series,
                                                       LocalDateTime from, LocalDateTime to,
                                                       SeverityThresholds thresholds) {
        Optional<BaselineModelEntity> model = baselineService
                .findLatestUsable(TargetType.EQUIPMENT, equipmentId, energySource)
                .filter(m -> m.getResolution() == resolution);
        if (model.isEmpty()) {
            log.debug("No usable {} baseline for {}, skipping model check", resolution, equipmentId);
            return List.of();
        }

        BaselineModelEntity baseline = model.get();
        List<String> features = baseline.getFeatureNames();
        Map<LocalDateTime, Double> expected = new HashMap<>();
        for (BucketRow row : aggregateStore.getSeries(equipmentId, energySource, resolution, features, from, to)) {
            if (row.hasAll(features)) {
                expected.put(row.getBucketStart(), BaselineRegression.predict(
                        baseline.getIntercept(), baseline.getCoefficients(), row.toArray(features)));
            }
        }

        List<SeriesPoint> withExpectation = series.stream()
                .filter(point -> !point.time().isBefore(from))
                .map(point -> new SeriesPoint(point.time(), point.observed(), expected.get(point.time())))
                .toList();
        return detector.detectModelDeviation(withExpectation, from, thresholds);
    }

    private int store(String equipmentId, String energySource, String metric, List<AnomalyFinding> findings) {
        int created = 0;
        List<AnomalyFinding> ordered = findings.stream()
                .sorted(Comparator.comparing(AnomalyFinding::detectedAt))
                .toList();

        for (AnomalyFinding finding : ordered) {
            Optional<AnomalyEntity> existing = anomalyRepository
                    .findByEquipmentIdAndDetectedAtAndMetric(equipmentId, finding.detectedAt(), metric);
            if (existing.isPresent()) {
                refresh(existing.get(), finding);
                continue;
            }

            AnomalyEntity entity = AnomalyEntity.builder()
                    .equipmentId(equipmentId)
                    .energySource(energySource)
                    .detectedAt(finding.detectedAt())
                    .metric(metric)
                    .observedValue(finding.observedValue())
                    .expectedValue(finding.expectedValue())
                    .deviationPercent(finding.deviationPercent())
                    .zScore(finding.zScore())
                    .severity(finding.severity())
                    .anomalyType(finding.type())
                    .detectionMethod(finding.method())
                    .resolved(false)
                    .build();

            try {
                AnomalyEntity saved = anomalyRepository.saveAndFlush(entity);
                created++;
                eventPublisher.publish(EventTopic.ANOMALY_DETECTED, toEventData(saved));
            } catch (DataIntegrityViolationException e) {
                // Concurrent sweep stored the same natural key first
                log.debug("Anomaly already stored: {} {} {}", equipmentId, finding.detectedAt(), metric);
            }
        }
        return created;
    }

    /**
     * Open anomalies follow the latest measurement; resolved ones stay as the audit record left them.
     */
    private void refresh(AnomalyEntity existing, AnomalyFinding finding) {
        if (existing.isResolved()) {
            return;
        }
        existing.setObservedValue(finding.observedValue());
        existing.setExpectedValue(finding.expectedValue());
        existing.setDeviationPercent(finding.deviationPercent());
        existing.setZScore(finding.zScore());
        existing.setSeverity(finding.severity());
        existing.setAnomalyType(finding.type());
        anomalyRepository.save(existing);
    }

    public List<AnomalyEntity> getRecentAnomalies(AnomalyFilter filter) {
        Specification<AnomalyEntity> spec = Specification.where(null);
        if (filter.getEquipmentId() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("equipmentId"), filter.getEquipmentId()));
        }
        if (filter.getSeverity() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("severity"), filter.getSeverity()));
        }
        if (filter.getResolved() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("resolved"), filter.getResolved()));
        }
        if (filter.getFrom() != null) {
            spec = spec.and((root, query, cb) ->
                    cb.greaterThanOrEqualTo(root.<LocalDateTime>get("detectedAt"), filter.getFrom()));
        }
        if (filter.getTo() != null) {
            spec = spec.and((root, query, cb) ->
                    cb.lessThan(root.<LocalDateTime>get("detectedAt"), filter.getTo()));
        }

        int limit = Math.max(1, Math.min(filter.getLimit(), 1000));
        return anomalyRepository.findAll(spec,
                PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "detectedAt"))).getContent();
    }

    @Transactional
    public AnomalyEntity resolveAnomaly(Long anomalyId, String note) {
        AnomalyEntity anomaly = anomalyRepository.findById(anomalyId)
                .orElseThrow(() -> new ResourceNotFoundException("Anomaly not found: " + anomalyId));
        anomaly.setResolved(true);
        anomaly.setResolutionNote(note);
        anomaly.setResolvedAt(LocalDateTime.now(clock));
        log.info("Resolved anomaly {} ({} {})", anomalyId, anomaly.getEquipmentId(), anomaly.getMetric());
        return anomalyRepository.save(anomaly);
    }

    public List<AnomalyEntity> getActiveAnomalies() {
        return anomalyRepository.findByResolvedFalseOrderByDetectedAtDesc();
    }

    public List<AnomalyEntity> getAnomaliesForDay(Collection<String> equipmentIds, LocalDate date) {
        return anomalyRepository.findForEquipmentBetween(equipmentIds,
                date.atStartOfDay(), date.plusDays(1).atStartOfDay());
    }

    private Map<String, Object> toEventData(AnomalyEntity anomaly) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("anomalyId", anomaly.getId());
        data.put("equipmentId", anomaly.getEquipmentId());
        data.put("energySource", anomaly.getEnergySource());
        data.put("detectedAt", anomaly.getDetectedAt());
        data.put("metric", anomaly.getMetric());
        data.put("observedValue", anomaly.getObservedValue());
        data.put("expectedValue", anomaly.getExpectedValue());
        data.put("deviationPercent", anomaly.getDeviationPercent());
        data.put("severity", anomaly.getSeverity());
        data.put("anomalyType", anomaly.getAnomalyType());
        return data;
    }
}
