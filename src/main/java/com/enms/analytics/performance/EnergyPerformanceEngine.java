package com.enms.analytics.performance;

import com.enms.analytics.aggregate.AggregateStore;
import com.enms.analytics.aggregate.FeatureResolver;
import com.enms.analytics.aggregate.QueryPlan;
import com.enms.analytics.aggregate.Resolution;
import com.enms.analytics.anomaly.Severity;
import com.enms.analytics.baseline.BaselineService;
import com.enms.analytics.baseline.TargetType;
import com.enms.analytics.config.PerformanceProperties;
import com.enms.analytics.exception.InsufficientPartialDataException;
import com.enms.analytics.exception.InvalidRequestException;
import com.enms.analytics.exception.NoDataForPeriodException;
import com.enms.analytics.exception.ResourceNotFoundException;
import com.enms.analytics.persistence.AnomalyEntity;
import com.enms.analytics.persistence.AnomalyRepository;
import com.enms.analytics.persistence.BaselineModelEntity;
import com.enms.analytics.persistence.EnergyReadingRepository;
import com.enms.analytics.persistence.SignificantEnergyUserEntity;
import com.enms.analytics.persistence.SignificantEnergyUserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Composes consumption, baseline, anomalies and KPIs into one performance report per SEU and day.
 * Only missing readings and an insufficient partial day abort the analysis; every other
 * missing input degrades the report.
 */
@Service
@Slf4j
public class EnergyPerformanceEngine {

    private static final double HOURS_PER_DAY = 24.0;
    private static final double ROLLING_AVERAGE_CONFIDENCE = 0.9;

    private final SignificantEnergyUserRepository seuRepository;
    private final EnergyReadingRepository readingRepository;
    private final AnomalyRepository anomalyRepository;
    private final BaselineService baselineService;
    private final FeatureResolver featureResolver;
    private final AggregateStore aggregateStore;
    private final KpiService kpiService;
    private final PerformanceProperties properties;
    private final PerformanceRules rules;
    private final VoiceSummaryComposer voiceSummary;
    private final Clock clock;

    public EnergyPerformanceEngine(SignificantEnergyUserRepository seuRepository,
                                   EnergyReadingRepository readingRepository,
                                   AnomalyRepository anomalyRepository,
                                   BaselineService baselineService,
                                   FeatureResolver featureResolver,
                                   AggregateStore aggregateStore,
                                   KpiService kpiService,
                                   PerformanceProperties properties,
                                   Clock clock) {
        this.seuRepository = seuRepository;
        this.readingRepository = readingRepository;
        this.anomalyRepository = anomalyRepository;
        this.baselineService = baselineService;
        this.featureResolver = featureResolver;
        this.aggregateStore = aggregateStore;
        this.kpiService = kpiService;
        this.properties = properties;
        this.rules = new PerformanceRules(properties);
        this.voiceSummary = new VoiceSummaryComposer(properties);
        this.clock = clock;
    }

    /**
     * @throws ResourceNotFoundException        unknown SEU
     * @throws InvalidRequestException          date in the future
     * @throws NoDataForPeriodException         no readings at all for the day
     * @throws InsufficientPartialDataException current day with too few hours elapsed
     */
    public PerformanceAnalysis analyze(String seuName, String energySource, LocalDate date) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        if (date.isAfter(today)) {
            throw new InvalidRequestException("Cannot analyze a future date: " + date);
        }

        SignificantEnergyUserEntity seu = seuRepository.findByNameIgnoreCase(seuName)
                .orElseThrow(() -> new ResourceNotFoundException("SEU not found: " + seuName));
        List<String> equipmentIds = List.copyOf(seu.getEquipmentIds());

        boolean inProgress = date.equals(today);
        LocalDateTime dayStart = date.atStartOfDay();
        LocalDateTime dayEnd = date.plusDays(1).atStartOfDay();
        LocalDateTime observedEnd = inProgress ? now : dayEnd;

        // Step 1: actual consumption, projected to a full day while the day is in progress
        long readings = readingRepository.countReadings(equipmentIds, energySource, dayStart, observedEnd);
        if (readings == 0) {
            throw new NoDataForPeriodException(seu.getName() + " (" + energySource + ")", date);
        }

        double hoursElapsed = inProgress
                ? Duration.between(dayStart, now).toSeconds() / 3600.0
                : HOURS_PER_DAY;
        if (inProgress && hoursElapsed < properties.getMinPartialHours()) {
            throw new InsufficientPartialDataException(String.format(
                    "Only %.1f hours of %s elapsed, at least %.1f required",
                    hoursElapsed, date, properties.getMinPartialHours()));
        }

        double actualRaw = readingRepository.sumValue(equipmentIds, energySource, dayStart, observedEnd);
        double actual = inProgress ? actualRaw / hoursElapsed * HOURS_PER_DAY : actualRaw;

        // Step 2: full-day baseline expectation
        BaselineEstimate baseline = estimateBaseline(seu, equipmentIds, energySource, dayStart, observedEnd);

        // Step 3: deviation
        Double deviation = null;
        Double deviationPercent = null;
        Double deviationCost = null;
        if (baseline.isAvailable()) {
            deviationPercent = BaselineService.deviationPercent(actual, baseline.expected());
            if (deviationPercent != null) {
                deviation = actual - baseline.expected();
                deviationCost = deviation * properties.unitCostFor(energySource);
            }
        }

        List<AnomalyEntity> anomalies = dayAnomalies(equipmentIds, dayStart, dayEnd);
        long critical = anomalies.stream().filter(a -> a.getSeverity() == Severity.CRITICAL).count();

        // Steps 4 to 7
        double baselineConfidence = deviationPercent != null ? baseline.confidenceFactor() : 0.0;
        RootCauseAnalysis rootCause = rules.rootCause(deviationPercent, hoursElapsed, baselineConfidence, critical);

        PerformanceAnalysis analysis = PerformanceAnalysis.builder()
                .seuName(seu.getName())
                .energySource(energySource)
                .date(date)
                .actualEnergy(actual)
                .actualRaw(actualRaw)
                .hoursElapsed(hoursElapsed)
                .projection(inProgress)
                .baselineEnergy(deviationPercent != null ? baseline.expected() : null)
                .baselineSource(deviationPercent != null ? baseline.source() : BaselineSource.UNAVAILABLE)
                .baselineModelVersion(deviationPercent != null ? baseline.modelVersion() : null)
                .deviation(deviation)
                .deviationPercent(deviationPercent)
                .deviationCost(deviationCost)
                .efficiencyScore(deviationPercent != null ? PerformanceRules.efficiencyScore(deviationPercent) : null)
                .rootCause(rootCause)
                .recommendations(rules.recommendations(deviationPercent, deviation,
                        properties.unitCostFor(energySource), critical))
                .complianceStatus(rules.complianceStatus(deviationPercent, critical))
                .anomalyCount(anomalies.size())
                .criticalAnomalyCount((int) critical)
                .kpis(kpis(equipmentIds, energySource, dayStart, observedEnd))
                .timestamp(Instant.now(clock))
                .build();

        // Step 8
        analysis.setVoiceSummary(voiceSummary.compose(analysis, inProgress));

        log.info("Analyzed {} ({}) {}: actual={} baseline={} ({}) deviation={}% status={}{}",
                seu.getName(), energySource, date, String.format("%.1f", actual),
                analysis.getBaselineEnergy(), analysis.getBaselineSource(),
                deviationPercent != null ? String.format("%.1f", deviationPercent) : "unknown",
                analysis.getComplianceStatus(), inProgress ? " (projection)" : "");
        return analysis;
    }

    /**
     * Regression prediction when a usable SEU model exists, else the rolling daily average.
     */
    private BaselineEstimate estimateBaseline(SignificantEnergyUserEntity seu, List<String> equipmentIds,
                                              String energySource, LocalDateTime dayStart,
                                              LocalDateTime observedEnd) {
        try {
            Optional<BaselineModelEntity> model = baselineService.findLatestUsable(
                    TargetType.SEU, seu.getName(), energySource);
            if (model.isPresent()) {
                OptionalDouble expected = baselineService.expectedDailyConsumption(
                        model.get(), equipmentIds, dayStart, observedEnd);
                if (expected.isPresent()) {
                    return new BaselineEstimate(expected.getAsDouble(), BaselineSource.REGRESSION,
                            model.get().getVersion(), model.get().getQualityTier().getConfidenceFactor());
                }
                log.warn("Baseline v{} for {} has no driver data on {}, falling back to rolling average",
                        model.get().getVersion(), seu.getName(), dayStart.toLocalDate());
            }
        } catch (RuntimeException e) {
            log.warn("Regression baseline unavailable for {}: {}", seu.getName(), e.getMessage());
        }

        try {
            String target = featureResolver.targetFeature(energySource);
            QueryPlan plan = featureResolver.resolve(energySource, List.of(target), Resolution.DAILY);
            LocalDateTime lookbackStart = dayStart.minusDays(properties.getBaselineLookbackDays());
            OptionalDouble average = aggregateStore.fetch(plan, equipmentIds, lookbackStart, dayStart).stream()
                    .map(row -> row.get(target))
                    .filter(Objects::nonNull)
                    .mapToDouble(Double::doubleValue)
                    .average();
            if (average.isPresent()) {
                return new BaselineEstimate(average.getAsDouble(), BaselineSource.ROLLING_AVERAGE,
                        null, ROLLING_AVERAGE_CONFIDENCE);
            }
        } catch (RuntimeException e) {
            log.warn("Rolling baseline unavailable for {}: {}", seu.getName(), e.getMessage());
        }

        log.warn("No baseline for {} ({}) on {}", seu.getName(), energySource, dayStart.toLocalDate());
        return BaselineEstimate.unavailable();
    }

    private List<AnomalyEntity> dayAnomalies(List<String> equipmentIds, LocalDateTime dayStart, LocalDateTime dayEnd) {
        try {
            return anomalyRepository.findForEquipmentBetween(equipmentIds, dayStart, dayEnd);
        } catch (RuntimeException e) {
            log.warn("Anomaly lookup failed, continuing without anomalies: {}", e.getMessage());
            return List.of();
        }
    }

    private KpiSummary kpis(List<String> equipmentIds, String energySource,
                            LocalDateTime from, LocalDateTime to) {
        try {
            return kpiService.calculate(equipmentIds, energySource, from, to);
        } catch (RuntimeException e) {
            log.warn("KPI computation failed, continuing without KPIs: {}", e.getMessage());
            return null;
        }
    }
}
