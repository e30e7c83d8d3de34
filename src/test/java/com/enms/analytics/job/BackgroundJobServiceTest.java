package com.enms.analytics.job;

import com.enms.analytics.BaseIntegrationTest;
import com.enms.analytics.baseline.BaselineService;
import com.enms.analytics.baseline.QualityTier;
import com.enms.analytics.baseline.TargetType;
import com.enms.analytics.baseline.TrainingRequest;
import com.enms.analytics.dto.BaselineModelSummary;
import com.enms.analytics.event.EnergyEventPublisher;
import com.enms.analytics.event.EventTopic;
import com.enms.analytics.persistence.TrainingJobEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("BackgroundJobService Tests")
class BackgroundJobServiceTest extends BaseIntegrationTest {

    @MockBean
    private EnergyEventPublisher eventPublisher;

    @MockBean
    private BaselineService baselineService;

    @Autowired
    private BackgroundJobService backgroundJobService;

    @Autowired
    private TrainingJobService jobService;

    @Test
    @DisplayName("Training that ends after the job timed out is reported as failed")
    @SuppressWarnings("unchecked")
    void lateCompletionReportedAsFailed() {
        // Given: the watchdog times the job out while the model is being fitted
        TrainingRequest request = request();
        when(baselineService.train(any())).thenAnswer(invocation -> {
            clock.advance(Duration.ofMinutes(31));
            jobService.failStaleJobs(Duration.ofMinutes(30));
            return summary();
        });

        // When
        BaselineModelSummary result = backgroundJobService.trainBaseline(request);

        // Then
        assertEquals(2, result.getVersion());
        TrainingJobEntity job = jobService.getRecentJobs().get(0);
        assertEquals(JobStatus.FAILED, job.getStatus());
        assertThat(job.getStatusMessage()).startsWith("Timed out after 30 minutes");

        ArgumentCaptor<Object> data = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publish(eq(EventTopic.TRAINING_COMPLETED), data.capture());
        Map<String, Object> completed = (Map<String, Object>) data.getValue();
        assertThat(completed)
                .containsEntry("jobId", job.getId())
                .containsEntry("status", "failed")
                .containsEntry("modelVersion", 2);
        assertThat((String) completed.get("error")).contains("FAILED").contains("Timed out");
    }

    @Test
    @DisplayName("Training that completes in time is reported as completed")
    @SuppressWarnings("unchecked")
    void completionReported() {
        when(baselineService.train(any())).thenReturn(summary());

        backgroundJobService.trainBaseline(request());

        TrainingJobEntity job = jobService.getRecentJobs().get(0);
        assertEquals(JobStatus.COMPLETED, job.getStatus());
        assertEquals("model:7", job.getResultRef());

        ArgumentCaptor<Object> data = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher).publish(eq(EventTopic.TRAINING_COMPLETED), data.capture());
        assertThat((Map<String, Object>) data.getValue())
                .containsEntry("status", "completed")
                .containsEntry("qualityTier", QualityTier.MEETS_THRESHOLD);
        verify(eventPublisher, times(2)).publish(eq(EventTopic.TRAINING_PROGRESS), any());
    }

    private TrainingRequest request() {
        return TrainingRequest.builder()
                .targetType(TargetType.SEU)
                .targetId("Compressor-1")
                .energySource("electricity")
                .from(LocalDateTime.of(2025, 2, 10, 0, 0))
                .to(LocalDateTime.of(2025, 3, 12, 0, 0))
                .features(List.of("production_count"))
                .triggerReason("manual")
                .build();
    }

    private BaselineModelSummary summary() {
        return BaselineModelSummary.builder()
                .modelId(7L)
                .targetType(TargetType.SEU)
                .targetId("Compressor-1")
                .energySource("electricity")
                .version(2)
                .rSquared(0.82)
                .qualityTier(QualityTier.MEETS_THRESHOLD)
                .build();
    }
}
