package com.enms.analytics.persistence;

import com.enms.analytics.anomaly.AnomalyType;
import com.enms.analytics.anomaly.DetectionMethod;
import com.enms.analytics.anomaly.Severity;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Detected anomaly. Kept forever as an audit trail; only the resolution fields change.
 */
@Entity
@Table(name = "anomalies",
        uniqueConstraints = @UniqueConstraint(name = "uk_anomaly_natural_key",
                columnNames = {"equipment_id", "detected_at", "metric"}),
        indexes = @Index(name = "idx_anomaly_detected_at", columnList = "detected_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "equipment_id", length = 64, nullable = false)
    private String equipmentId;

    @Column(name = "energy_source", length = 50, nullable = false)
    private String energySource;

    @Column(name = "detected_at", nullable = false)
    private LocalDateTime detectedAt;

    @Column(name = "metric", length = 120, nullable = false)
    private String metric;

    @Column(name = "observed_value", nullable = false)
    private double observedValue;

    @Column(name = "expected_value", nullable = false)
    private double expectedValue;

    @Column(name = "deviation_percent")
    private Double deviationPercent;

    @Getter(onMethod_ = @JsonProperty("zScore"))
    @Column(name = "z_score")
    private Double zScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", length = 16, nullable = false)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "anomaly_type", length = 16, nullable = false)
    private AnomalyType anomalyType;

    @Enumerated(EnumType.STRING)
    @Column(name = "detection_method", length = 24, nullable = false)
    private DetectionMethod detectionMethod;

    @Column(name = "resolved", nullable = false)
    private boolean resolved;

    @Column(name = "resolution_note", length = 1000)
    private String resolutionNote;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
