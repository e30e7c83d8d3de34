package com.enms.analytics.scheduler;

import com.enms.analytics.event.EnergyEventPublisher;
import com.enms.analytics.event.EventTopic;
import com.enms.analytics.job.TrainingJobService;
import com.enms.analytics.persistence.TrainingJobEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fails jobs stuck in a non-terminal state so their target can be trained again.
 */
@Component
@Slf4j
public class JobWatchdogScheduler {

    private final TrainingJobService jobService;
    private final EnergyEventPublisher eventPublisher;
    private final Duration timeout;

    public JobWatchdogScheduler(TrainingJobService jobService,
                                EnergyEventPublisher eventPublisher,
                                @Value("${jobs.timeout-minutes:30}") long timeoutMinutes) {
        this.jobService = jobService;
        this.eventPublisher = eventPublisher;
        this.timeout = Duration.ofMinutes(timeoutMinutes);
    }

    @Scheduled(initialDelay = 60000, fixedDelay = 60000)
    public void failStaleJobs() {
        try {
            List<TrainingJobEntity> stale = jobService.failStaleJobs(timeout);
            for (TrainingJobEntity job : stale) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("level", "warning");
                data.put("message", "Job " + job.getId() + " (" + job.getJobType() + " for "
                        + job.getTargetId() + ") timed out after " + timeout.toMinutes() + " minutes");
                data.put("jobId", job.getId());
                eventPublisher.publish(EventTopic.SYSTEM_ALERT, data);
            }
        } catch (Exception e) {
            log.error("Error during job watchdog run: {}", e.getMessage());
        }
    }
}
