package com.enms.analytics.persistence;

import com.enms.analytics.aggregate.AggregationFunction;
import com.enms.analytics.aggregate.FeatureRole;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Registry entry describing how a named driver is computed from the aggregate store
 * for one energy source. Supporting a new energy source means inserting rows here.
 */
@Entity
@Table(name = "energy_source_features",
        uniqueConstraints = @UniqueConstraint(name = "uk_feature_per_source",
                columnNames = {"energy_source", "feature_name"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureDefinitionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "energy_source", length = 50, nullable = false)
    private String energySource;

    @Column(name = "feature_name", length = 100, nullable = false)
    private String featureName;

    /**
     * Rollup family name; the physical table is {@code <source_table>_<resolution suffix>}.
     */
    @Column(name = "source_table", length = 100, nullable = false)
    private String sourceTable;

    @Column(name = "source_column", length = 100, nullable = false)
    private String sourceColumn;

    @Enumerated(EnumType.STRING)
    @Column(name = "aggregation_function", length = 16, nullable = false)
    private AggregationFunction aggregationFunction;

    /**
     * SQL aggregate expression for CUSTOM aggregation, with {@code {column}} as placeholder.
     */
    @Column(name = "custom_expression", length = 255)
    private String customExpression;

    @Enumerated(EnumType.STRING)
    @Column(name = "feature_role", length = 16, nullable = false)
    private FeatureRole role;

    @Column(name = "description")
    private String description;

    @Column(name = "active")
    private boolean active;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
