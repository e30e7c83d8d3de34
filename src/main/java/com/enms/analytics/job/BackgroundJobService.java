package com.enms.analytics.job;

import com.enms.analytics.anomaly.AnomalyService;
import com.enms.analytics.anomaly.SeverityThresholds;
import com.enms.analytics.baseline.BaselineService;
import com.enms.analytics.baseline.TargetType;
import com.enms.analytics.baseline.TrainingRequest;
import com.enms.analytics.dto.BaselineModelSummary;
import com.enms.analytics.event.EnergyEventPublisher;
import com.enms.analytics.event.EventTopic;
import com.enms.analytics.persistence.AnomalyEntity;
import com.enms.analytics.persistence.TrainingJobEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs training and detection through the job state machine, either inline or on the job executor,
 * and reports lifecycle events on the bus.
 */
@Service
@Slf4j
public class BackgroundJobService {

    private final TrainingJobService jobService;
    private final BaselineService baselineService;
    private final AnomalyService anomalyService;
    private final EnergyEventPublisher eventPublisher;
    private final TaskExecutor jobExecutor;

    public BackgroundJobService(TrainingJobService jobService,
                                BaselineService baselineService,
                                AnomalyService anomalyService,
                                EnergyEventPublisher eventPublisher,
                                @Qualifier("jobExecutor") TaskExecutor jobExecutor) {
        this.jobService = jobService;
        this.baselineService = baselineService;
        this.anomalyService = anomalyService;
        this.eventPublisher = eventPublisher;
        this.jobExecutor = jobExecutor;
    }

    /**
     * Train inline on the caller's thread. Conflicts and training errors reach the caller.
     */
    public BaselineModelSummary trainBaseline(TrainingRequest request) {
        TrainingJobEntity job = jobService.createJob(JobType.BASELINE_TRAINING, request.getTargetType(),
                request.getTargetId(), request.getEnergySource(), request.getTriggerReason());
        return runTraining(job, request);
    }

    /**
     * Create the job now and train on the job executor. A conflict is reported at once.
     */
    public TrainingJobEntity submitTraining(TrainingRequest request) {
        TrainingJobEntity job = jobService.createJob(JobType.BASELINE_TRAINING, request.getTargetType(),
                request.getTargetId(), request.getEnergySource(), request.getTriggerReason());
        execute(job, () -> {
            try {
                runTraining(job, request);
            } catch (RuntimeException e) {
                log.error("Background training job {} failed: {}", job.getId(), e.getMessage());
            }
        });
        return job;
    }

    public List<AnomalyEntity> runDetectionSweep(String equipmentId, String energySource,
                                                 LocalDateTime from, LocalDateTime to,
                                                 SeverityThresholds thresholds, String triggerReason) {
        TrainingJobEntity job = jobService.createJob(JobType.ANOMALY_SWEEP, TargetType.EQUIPMENT,
                equipmentId, energySource, triggerReason);
        return runSweep(job, equipmentId, energySource, from, to, thresholds);
    }

    public TrainingJobEntity submitDetectionSweep(String equipmentId, String energySource,
                                                  LocalDateTime from, LocalDateTime to,
                                                  SeverityThresholds thresholds, String triggerReason) {
        TrainingJobEntity job = jobService.createJob(JobType.ANOMALY_SWEEP, TargetType.EQUIPMENT,
                equipmentId, energySource, triggerReason);
        execute(job, () -> {
            try {
                runSweep(job, equipmentId, energySource, from, to, thresholds);
            } catch (RuntimeException e) {
                log.error("Background detection job {} failed: {}", job.getId(), e.getMessage());
            }
        });
        return job;
    }

    private BaselineModelSummary runTraining(TrainingJobEntity job, TrainingRequest request) {
        Long jobId = job.getId();
        if (!jobService.markRunning(jobId)) {
            throw new IllegalStateException("Job " + jobId + " is no longer pending");
        }
        eventPublisher.publish(EventTopic.TRAINING_STARTED, jobData(job, "running"));

        try {
            progress(job, 10, "Loading training data");
            BaselineModelSummary summary = baselineService.train(request);
            progress(job, 90, "Storing model v" + summary.getVersion());

            String message = String.format("Model v%d trained, R²=%.4f, tier %s",
                    summary.getVersion(), summary.getRSquared(), summary.getQualityTier());
            if (!jobService.markCompleted(jobId, "model:" + summary.getModelId(), message)) {
                // Watchdog finished the job first; the trained model is stored regardless
                TrainingJobEntity current = jobService.getJob(jobId);
                log.warn("Training job {} finished after it was already {}: {}", jobId,
                        current.getStatus(), current.getStatusMessage());
                Map<String, Object> data = jobData(job, "failed");
                data.put("error", "Job already " + current.getStatus() + ": " + current.getStatusMessage());
                data.put("modelVersion", summary.getVersion());
                eventPublisher.publish(EventTopic.TRAINING_COMPLETED, data);
                return summary;
            }

            Map<String, Object> data = jobData(job, "completed");
            data.put("modelVersion", summary.getVersion());
            data.put("rSquared", summary.getRSquared());
            data.put("qualityTier", summary.getQualityTier());
            eventPublisher.publish(EventTopic.TRAINING_COMPLETED, data);
            return summary;
        } catch (RuntimeException e) {
            failed(job, e);
            throw e;
        }
    }

    private List<AnomalyEntity> runSweep(TrainingJobEntity job, String equipmentId, String energySource,
                                         LocalDateTime from, LocalDateTime to, SeverityThresholds thresholds) {
        Long jobId = job.getId();
        if (!jobService.markRunning(jobId)) {
            throw new IllegalStateException("Job " + jobId + " is no longer pending");
        }
        try {
            List<AnomalyEntity> anomalies = anomalyService.detectAnomalies(equipmentId, energySource,
                    from, to, thresholds);
            if (!jobService.markCompleted(jobId, null, anomalies.size() + " anomalies in window")) {
                log.warn("Detection job {} finished after it was already terminal", jobId);
            }
            return anomalies;
        } catch (RuntimeException e) {
            jobService.markFailed(jobId, e.getMessage());
            throw e;
        }
    }

    private void execute(TrainingJobEntity job, Runnable task) {
        try {
            jobExecutor.execute(task);
        } catch (TaskRejectedException e) {
            log.warn("Job executor rejected job {}: {}", job.getId(), e.getMessage());
            jobService.markFailed(job.getId(), "Rejected by job executor: queue full");
        }
    }

    private void progress(TrainingJobEntity job, int pct, String message) {
        jobService.updateProgress(job.getId(), pct, message);
        Map<String, Object> data = jobData(job, "running");
        data.put("progressPct", pct);
        data.put("message", message);
        eventPublisher.publish(EventTopic.TRAINING_PROGRESS, data);
    }

    private void failed(TrainingJobEntity job, RuntimeException e) {
        jobService.markFailed(job.getId(), e.getMessage());
        Map<String, Object> data = jobData(job, "failed");
        data.put("error", e.getMessage());
        eventPublisher.publish(EventTopic.TRAINING_COMPLETED, data);
    }

    private Map<String, Object> jobData(TrainingJobEntity job, String status) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("jobId", job.getId());
        data.put("jobType", job.getJobType());
        data.put("targetType", job.getTargetType());
        data.put("targetId", job.getTargetId());
        data.put("energySource", job.getEnergySource());
        data.put("status", status);
        return data;
    }
}
