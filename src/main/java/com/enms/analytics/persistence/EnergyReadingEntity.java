package com.enms.analytics.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Raw normalized reading written by the ingestion pipeline. Read-only for analytics.
 */
@Entity
@Table(name = "energy_readings",
        uniqueConstraints = @UniqueConstraint(name = "uk_reading_natural_key",
                columnNames = {"equipment_id", "energy_type", "reading_time"}),
        indexes = @Index(name = "idx_reading_time", columnList = "reading_time"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnergyReadingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "reading_time", nullable = false)
    private LocalDateTime time;

    @Column(name = "equipment_id", length = 64, nullable = false)
    private String equipmentId;

    @Column(name = "energy_type", length = 50, nullable = false)
    private String energyType;

    // Consumption over the reading interval, in the energy type's unit (kWh, m3, ...)
    @Column(name = "reading_value", nullable = false)
    private double value;

    @Column(name = "power_kw")
    private Double powerKw;

    @Column(name = "production_count")
    private Double productionCount;

    @Column(name = "outdoor_temp_c")
    private Double outdoorTempC;

    @Column(name = "pressure_bar")
    private Double pressureBar;

    @Column(name = "load_factor")
    private Double loadFactor;
}
