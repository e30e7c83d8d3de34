package com.enms.analytics.persistence;

import com.enms.analytics.baseline.TargetType;
import com.enms.analytics.job.JobStatus;
import com.enms.analytics.job.JobType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Persisted state machine of a background job.
 * {@code activeKey} is set while the job is non-terminal and cleared on the terminal
 * transition; its unique constraint is what guarantees a single active job per target.
 */
@Entity
@Table(name = "training_jobs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingJobEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_type", length = 32, nullable = false)
    private JobType jobType;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_type", length = 16, nullable = false)
    private TargetType targetType;

    @Column(name = "target_id", length = 100, nullable = false)
    private String targetId;

    @Column(name = "energy_source", length = 50)
    private String energySource;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    private JobStatus status;

    @Column(name = "active_key", length = 200, unique = true)
    private String activeKey;

    @Column(name = "trigger_reason", length = 200)
    private String triggerReason;

    @Column(name = "progress_pct")
    private int progressPct;

    @Column(name = "status_message", length = 500)
    private String statusMessage;

    @Column(name = "result_ref", length = 100)
    private String resultRef;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "ended_at")
    private LocalDateTime endedAt;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
