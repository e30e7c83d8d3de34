package com.enms.analytics.job;

import com.enms.analytics.BaseIntegrationTest;
import com.enms.analytics.baseline.TargetType;
import com.enms.analytics.baseline.TrainingRequest;
import com.enms.analytics.exception.InsufficientSamplesException;
import com.enms.analytics.exception.ResourceNotFoundException;
import com.enms.analytics.exception.TrainingInProgressException;
import com.enms.analytics.persistence.TrainingJobEntity;
import com.enms.analytics.persistence.TrainingJobRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Job Tests")
class TrainingJobServiceTest extends BaseIntegrationTest {

    @Autowired
    private TrainingJobService jobService;

    @Autowired
    private BackgroundJobService backgroundJobService;

    @Autowired
    private TrainingJobRepository jobRepository;

    @Nested
    @DisplayName("State machine")
    class StateMachineTests {

        @Test
        @DisplayName("Second job for the same target is rejected with the active job id")
        void duplicateRejected() {
            TrainingJobEntity first = create("Compressor-1");

            TrainingInProgressException ex = assertThrows(TrainingInProgressException.class,
                    () -> create("Compressor-1"));

            assertEquals(first.getId(), ex.getActiveJobId());
            assertEquals(1, jobRepository.count());
        }

        @Test
        @DisplayName("Concurrent requests for one target create exactly one job")
        void concurrentCreate() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Boolean>> results = new ArrayList<>();
                for (int i = 0; i < 2; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        try {
                            jobService.createJob(JobType.BASELINE_TRAINING, TargetType.EQUIPMENT,
                                    "compressor-1", "electricity", "api");
                            return true;
                        } catch (TrainingInProgressException e) {
                            return false;
                        }
                    }));
                }
                start.countDown();

                int created = 0;
                for (Future<Boolean> result : results) {
                    if (result.get(10, TimeUnit.SECONDS)) {
                        created++;
                    }
                }
                assertEquals(1, created);
                assertEquals(1, jobRepository.count());
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("Other targets are independent")
        void independentTargets() {
            create("Compressor-1");
            create("Compressor-2");
            jobService.createJob(JobType.ANOMALY_SWEEP, TargetType.EQUIPMENT, "compressor-1", "electricity", "test");

            assertEquals(3, jobRepository.count());
        }

        @Test
        @DisplayName("Sweep and training for the same target conflict")
        void otherJobTypeSameTargetConflicts() {
            TrainingJobEntity training = create("Compressor-1");

            TrainingInProgressException ex = assertThrows(TrainingInProgressException.class,
                    () -> jobService.createJob(JobType.ANOMALY_SWEEP, TargetType.SEU, "Compressor-1",
                            "electricity", "test"));

            assertEquals(training.getId(), ex.getActiveJobId());
            assertEquals(1, jobRepository.count());
        }

        @Test
        @DisplayName("Terminal job frees its target")
        void lifecycle() {
            TrainingJobEntity job = create("Compressor-1");

            assertTrue(jobService.markRunning(job.getId()));
            assertFalse(jobService.markRunning(job.getId()));
            jobService.updateProgress(job.getId(), 150, "Fitting");
            assertEquals(100, jobService.getJob(job.getId()).getProgressPct());

            assertTrue(jobService.markCompleted(job.getId(), "model:1", "done"));
            assertFalse(jobService.markFailed(job.getId(), "late failure"));

            TrainingJobEntity finished = jobService.getJob(job.getId());
            assertEquals(JobStatus.COMPLETED, finished.getStatus());
            assertEquals("model:1", finished.getResultRef());
            assertNull(finished.getActiveKey());
            assertNotNull(finished.getEndedAt());

            TrainingJobEntity next = create("Compressor-1");
            assertEquals(JobStatus.PENDING, next.getStatus());
        }

        @Test
        @DisplayName("Stale jobs are failed by the sweep")
        void staleJobs() {
            TrainingJobEntity stale = create("Compressor-1");
            clock.advance(Duration.ofMinutes(20));
            TrainingJobEntity fresh = create("Compressor-2");
            clock.advance(Duration.ofMinutes(11));

            List<TrainingJobEntity> failed = jobService.failStaleJobs(Duration.ofMinutes(30));

            assertEquals(1, failed.size());
            assertEquals(stale.getId(), failed.get(0).getId());
            assertEquals(JobStatus.FAILED, jobService.getJob(stale.getId()).getStatus());
            assertThat(jobService.getJob(stale.getId()).getStatusMessage()).startsWith("Timed out after 30 minutes");
            assertEquals(JobStatus.PENDING, jobService.getJob(fresh.getId()).getStatus());
        }

        @Test
        @DisplayName("Unknown job is not found")
        void unknownJob() {
            assertThrows(ResourceNotFoundException.class, () -> jobService.getJob(12345L));
        }
    }

    @Nested
    @DisplayName("Background runner")
    class BackgroundTests {

        @Test
        @DisplayName("Training failure marks the job failed and frees the target")
        void failedTraining() {
            createEquipment("press-1");
            TrainingRequest request = TrainingRequest.builder()
                    .targetType(TargetType.EQUIPMENT)
                    .targetId("press-1")
                    .energySource("electricity")
                    .from(LocalDateTime.of(2025, 3, 1, 0, 0))
                    .to(LocalDateTime.of(2025, 3, 2, 0, 0))
                    .features(List.of("production_count"))
                    .triggerReason("manual")
                    .build();

            assertThrows(InsufficientSamplesException.class, () -> backgroundJobService.trainBaseline(request));

            List<TrainingJobEntity> jobs = jobService.getRecentJobs();
            assertEquals(1, jobs.size());
            assertEquals(JobStatus.FAILED, jobs.get(0).getStatus());
            assertEquals("manual", jobs.get(0).getTriggerReason());
            assertThat(jobs.get(0).getStatusMessage()).contains("Insufficient training samples");

            assertThrows(InsufficientSamplesException.class, () -> backgroundJobService.trainBaseline(request));
            assertEquals(2, jobRepository.count());
        }
    }

    private TrainingJobEntity create(String seuName) {
        return jobService.createJob(JobType.BASELINE_TRAINING, TargetType.SEU, seuName, "electricity", "test");
    }
}
