package com.enms.analytics.job;

import com.enms.analytics.baseline.TargetType;
import com.enms.analytics.exception.ResourceNotFoundException;
import com.enms.analytics.exception.TrainingInProgressException;
import com.enms.analytics.persistence.TrainingJobEntity;
import com.enms.analytics.persistence.TrainingJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persisted job state machine: {@code PENDING -> RUNNING -> COMPLETED | FAILED}.
 * At most one non-terminal job of any type exists per target; the unique {@code active_key}
 * column makes the check-and-insert atomic in the database.
 */
@Service
@Slf4j
public class TrainingJobService {

    private static final Set<JobStatus> ACTIVE = EnumSet.of(JobStatus.PENDING, JobStatus.RUNNING);

    private final TrainingJobRepository jobRepository;
    private final Clock clock;

    public TrainingJobService(TrainingJobRepository jobRepository, Clock clock) {
        this.jobRepository = jobRepository;
        this.clock = clock;
    }

    /**
     * @throws TrainingInProgressException if a non-terminal job of the same type exists for the target
     */
    public TrainingJobEntity createJob(JobType jobType, TargetType targetType, String targetId,
                                       String energySource, String triggerReason) {
        String activeKey = activeKey(targetType, targetId);

        Optional<TrainingJobEntity> existing = jobRepository.findByActiveKey(activeKey);
        if (existing.isPresent()) {
            throw new TrainingInProgressException(activeKey, existing.get().getId());
        }

        TrainingJobEntity job = TrainingJobEntity.builder()
                .jobType(jobType)
                .targetType(targetType)
                .targetId(targetId)
                .energySource(energySource)
                .status(JobStatus.PENDING)
                .activeKey(activeKey)
                .triggerReason(triggerReason)
                .progressPct(0)
                .createdAt(LocalDateTime.now(clock))
                .build();

        try {
            TrainingJobEntity saved = jobRepository.saveAndFlush(job);
            log.info("Created {} job {} for {} {} ({})", jobType, saved.getId(), targetType, targetId, triggerReason);
            return saved;
        } catch (DataIntegrityViolationException e) {
            // Lost the insert race against another request for the same target
            Long activeJobId = jobRepository.findByActiveKey(activeKey).map(TrainingJobEntity::getId).orElse(null);
            throw new TrainingInProgressException(activeKey, activeJobId);
        }
    }

    @Transactional
    public boolean markRunning(Long jobId) {
        boolean updated = jobRepository.markRunning(jobId, JobStatus.PENDING, JobStatus.RUNNING,
                LocalDateTime.now(clock)) == 1;
        if (!updated) {
            log.warn("Job {} could not start: no longer pending", jobId);
        }
        return updated;
    }

    @Transactional
    public void updateProgress(Long jobId, int progressPct, String message) {
        jobRepository.updateProgress(jobId, ACTIVE, Math.max(0, Math.min(100, progressPct)), message);
    }

    @Transactional
    public boolean markCompleted(Long jobId, String resultRef, String message) {
        return finish(jobId, JobStatus.COMPLETED, message, resultRef);
    }

    @Transactional
    public boolean markFailed(Long jobId, String message) {
        return finish(jobId, JobStatus.FAILED, message, null);
    }

    private boolean finish(Long jobId, JobStatus status, String message, String resultRef) {
        boolean updated = jobRepository.finish(jobId, ACTIVE, status, truncate(message), resultRef,
                LocalDateTime.now(clock)) == 1;
        if (updated) {
            log.info("Job {} {}: {}", jobId, status, message);
        } else {
            log.warn("Job {} already terminal, ignoring transition to {}", jobId, status);
        }
        return updated;
    }

    /**
     * Force-fail pending or running jobs created longer than {@code timeout} ago.
     *
     * @return the jobs that were failed by this sweep
     */
    @Transactional
    public List<TrainingJobEntity> failStaleJobs(Duration timeout) {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(timeout);
        List<TrainingJobEntity> failed = new ArrayList<>();
        for (TrainingJobEntity job : jobRepository.findStale(ACTIVE, cutoff)) {
            String message = "Timed out after " + timeout.toMinutes() + " minutes in " + job.getStatus();
            if (finish(job.getId(), JobStatus.FAILED, message, null)) {
                failed.add(job);
            }
        }
        return failed;
    }

    public TrainingJobEntity getJob(Long jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + jobId));
    }

    public List<TrainingJobEntity> getRecentJobs() {
        return jobRepository.findTop50ByOrderByCreatedAtDesc();
    }

    public static String activeKey(TargetType targetType, String targetId) {
        return targetType + ":" + targetId;
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= 500) {
            return message;
        }
        return message.substring(0, 500);
    }
}
