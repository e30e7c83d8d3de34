package com.enms.analytics.scheduler;

import com.enms.analytics.config.DetectionProperties;
import com.enms.analytics.exception.TrainingInProgressException;
import com.enms.analytics.job.BackgroundJobService;
import com.enms.analytics.persistence.AnomalyEntity;
import com.enms.analytics.persistence.EnergyReadingRepository;
import com.enms.analytics.persistence.EquipmentUnitEntity;
import com.enms.analytics.persistence.EquipmentUnitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Hourly detection sweep over every active equipment unit and each energy type it reports.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AnomalyDetectionScheduler {

    static final String TRIGGER = "scheduled_hourly";

    private final EquipmentUnitRepository equipmentRepository;
    private final EnergyReadingRepository readingRepository;
    private final BackgroundJobService jobService;
    private final DetectionProperties properties;
    private final Clock clock;

    private final AtomicBoolean sweepInProgress = new AtomicBoolean(false);

    // Five minutes past the hour, after the hourly rollup refresh
    @Scheduled(cron = "${anomaly.sweep.cron:0 5 * * * *}")
    public void sweep() {
        if (!sweepInProgress.compareAndSet(false, true)) {
            log.info("Detection sweep in progress, skipping scheduled run");
            return;
        }
        try {
            LocalDateTime to = LocalDateTime.now(clock);
            LocalDateTime from = to.minusHours(properties.getSweepHours());
            int found = 0;
            for (EquipmentUnitEntity unit : equipmentRepository.findByActiveTrueOrderById()) {
                for (String energyType : readingRepository.findEnergyTypes(unit.getId())) {
                    found += sweep(unit.getId(), energyType, from, to);
                }
            }
            log.info("Detection sweep {} - {}: {} anomalies in window", from, to, found);
        } catch (Exception e) {
            log.error("Error during scheduled detection sweep: {}", e.getMessage());
        } finally {
            sweepInProgress.set(false);
        }
    }

    private int sweep(String equipmentId, String energyType, LocalDateTime from, LocalDateTime to) {
        try {
            List<AnomalyEntity> anomalies = jobService.runDetectionSweep(equipmentId, energyType,
                    from, to, null, TRIGGER);
            return anomalies.size();
        } catch (TrainingInProgressException e) {
            log.debug("Skipping {} ({}): {}", equipmentId, energyType, e.getMessage());
        } catch (Exception e) {
            log.error("Detection for {} ({}) failed: {}", equipmentId, energyType, e.getMessage());
        }
        return 0;
    }
}
