package com.enms.analytics.persistence;

import com.enms.analytics.aggregate.Resolution;
import com.enms.analytics.baseline.QualityTier;
import com.enms.analytics.baseline.TargetType;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Trained baseline. Rows are never updated: retraining inserts the next version.
 */
@Entity
@Table(name = "baseline_models",
        uniqueConstraints = @UniqueConstraint(name = "uk_baseline_version",
                columnNames = {"target_type", "target_id", "energy_source", "model_version"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaselineModelEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_type", length = 16, nullable = false)
    private TargetType targetType;

    @Column(name = "target_id", length = 100, nullable = false)
    private String targetId;

    @Column(name = "energy_source", length = 50, nullable = false)
    private String energySource;

    @Column(name = "model_version", nullable = false)
    private int version;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "baseline_model_terms", joinColumns = @JoinColumn(name = "model_id"))
    @OrderColumn(name = "term_index")
    private List<ModelTerm> terms = new ArrayList<>();

    @Column(name = "intercept", nullable = false)
    private double intercept;

    @Column(name = "r_squared", nullable = false)
    private double rSquared;

    @Column(name = "rmse", nullable = false)
    private double rmse;

    @Column(name = "mae", nullable = false)
    private double mae;

    @Enumerated(EnumType.STRING)
    @Column(name = "quality_tier", length = 24, nullable = false)
    private QualityTier qualityTier;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution", length = 16, nullable = false)
    private Resolution resolution;

    @Column(name = "training_start", nullable = false)
    private LocalDateTime trainingStart;

    @Column(name = "training_end", nullable = false)
    private LocalDateTime trainingEnd;

    @Column(name = "sample_count", nullable = false)
    private int sampleCount;

    @Column(name = "auto_selected")
    private boolean autoSelected;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public List<String> getFeatureNames() {
        return terms.stream().map(ModelTerm::getFeatureName).toList();
    }

    public double[] getCoefficients() {
        return terms.stream().mapToDouble(ModelTerm::getCoefficient).toArray();
    }
}
