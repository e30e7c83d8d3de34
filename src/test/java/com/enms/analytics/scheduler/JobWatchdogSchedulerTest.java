package com.enms.analytics.scheduler;

import com.enms.analytics.BaseIntegrationTest;
import com.enms.analytics.baseline.TargetType;
import com.enms.analytics.event.EnergyEventPublisher;
import com.enms.analytics.event.EventTopic;
import com.enms.analytics.job.JobStatus;
import com.enms.analytics.job.JobType;
import com.enms.analytics.job.TrainingJobService;
import com.enms.analytics.persistence.TrainingJobEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@DisplayName("JobWatchdogScheduler Tests")
class JobWatchdogSchedulerTest extends BaseIntegrationTest {

    @MockBean
    private EnergyEventPublisher eventPublisher;

    @Autowired
    private TrainingJobService jobService;

    @Autowired
    private JobWatchdogScheduler watchdog;

    @Test
    @DisplayName("Timed-out job is failed and reported as a system alert")
    @SuppressWarnings("unchecked")
    void failsAndAlerts() {
        // Given: a job left pending past the timeout
        TrainingJobEntity job = jobService.createJob(JobType.BASELINE_TRAINING, TargetType.SEU,
                "Compressor-1", "electricity", "scheduled_weekly");
        clock.advance(Duration.ofMinutes(31));

        // When
        watchdog.failStaleJobs();

        // Then
        assertThat(jobService.getJob(job.getId()).getStatus()).isEqualTo(JobStatus.FAILED);
        ArgumentCaptor<Object> data = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publish(eq(EventTopic.SYSTEM_ALERT), data.capture());
        Map<String, Object> alert = (Map<String, Object>) data.getValue();
        assertThat(alert).containsEntry("jobId", job.getId()).containsEntry("level", "warning");
        assertThat((String) alert.get("message")).contains("timed out after 30 minutes");
    }

    @Test
    @DisplayName("Recent jobs are left alone")
    void leavesRecentJobs() {
        TrainingJobEntity job = jobService.createJob(JobType.ANOMALY_SWEEP, TargetType.EQUIPMENT,
                "chiller-1", "electricity", "scheduled_hourly");
        clock.advance(Duration.ofMinutes(5));

        watchdog.failStaleJobs();

        assertThat(jobService.getJob(job.getId()).getStatus()).isEqualTo(JobStatus.PENDING);
        verify(eventPublisher, never()).publish(any(), any());
    }
}
