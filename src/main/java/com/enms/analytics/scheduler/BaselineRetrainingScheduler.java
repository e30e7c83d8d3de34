package com.enms.analytics.scheduler;

import com.enms.analytics.baseline.TargetType;
import com.enms.analytics.baseline.TrainingRequest;
import com.enms.analytics.dto.BaselineModelSummary;
import com.enms.analytics.exception.TrainingInProgressException;
import com.enms.analytics.job.BackgroundJobService;
import com.enms.analytics.persistence.SignificantEnergyUserEntity;
import com.enms.analytics.persistence.SignificantEnergyUserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Weekly retraining of every active SEU baseline with automatic driver selection.
 */
@Component
@Slf4j
public class BaselineRetrainingScheduler {

    static final String TRIGGER = "scheduled_weekly";

    private final SignificantEnergyUserRepository seuRepository;
    private final BackgroundJobService jobService;
    private final Clock clock;
    private final int trainingDays;

    private final AtomicBoolean retrainInProgress = new AtomicBoolean(false);

    public BaselineRetrainingScheduler(SignificantEnergyUserRepository seuRepository,
                                       BackgroundJobService jobService,
                                       Clock clock,
                                       @Value("${baseline.retrain.training-days:90}") int trainingDays) {
        this.seuRepository = seuRepository;
        this.jobService = jobService;
        this.clock = clock;
        this.trainingDays = trainingDays;
    }

    @Scheduled(cron = "${baseline.retrain.cron:0 0 2 * * SUN}")
    public void retrainAll() {
        if (!retrainInProgress.compareAndSet(false, true)) {
            log.info("Baseline retraining in progress, skipping scheduled run");
            return;
        }
        try {
            LocalDate today = LocalDate.now(clock);
            int trained = 0;
            for (SignificantEnergyUserEntity seu : seuRepository.findByActiveTrueOrderByName()) {
                if (retrain(seu, today)) {
                    trained++;
                }
            }
            log.info("Weekly retraining finished: {} baselines trained", trained);
        } finally {
            retrainInProgress.set(false);
        }
    }

    private boolean retrain(SignificantEnergyUserEntity seu, LocalDate today) {
        TrainingRequest request = TrainingRequest.builder()
                .targetType(TargetType.SEU)
                .targetId(seu.getName())
                .energySource(seu.getEnergySource())
                .from(today.minusDays(trainingDays).atStartOfDay())
                .to(today.atStartOfDay())
                .triggerReason(TRIGGER)
                .build();
        try {
            BaselineModelSummary summary = jobService.trainBaseline(request);
            log.info("Retrained {} ({}): v{} R²={} tier {}", seu.getName(), seu.getEnergySource(),
                    summary.getVersion(), String.format("%.3f", summary.getRSquared()), summary.getQualityTier());
            return true;
        } catch (TrainingInProgressException e) {
            log.info("Skipping {}: {}", seu.getName(), e.getMessage());
        } catch (Exception e) {
            log.error("Retraining {} ({}) failed: {}", seu.getName(), seu.getEnergySource(), e.getMessage());
        }
        return false;
    }
}
