package com.enms.analytics.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Common columns of every reading rollup. Each resolution has its own table and
 * is rebuilt from raw readings only.
 */
@MappedSuperclass
@Getter
@Setter
public abstract class ReadingRollup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "equipment_id", length = 64, nullable = false)
    private String equipmentId;

    @Column(name = "energy_type", length = 50, nullable = false)
    private String energyType;

    @Column(name = "bucket_start", nullable = false)
    private LocalDateTime bucketStart;

    @Column(name = "total_value", nullable = false)
    private double totalValue;

    @Column(name = "avg_power_kw")
    private Double avgPowerKw;

    @Column(name = "max_power_kw")
    private Double maxPowerKw;

    @Column(name = "production_count")
    private Double productionCount;

    @Column(name = "avg_outdoor_temp_c")
    private Double avgOutdoorTempC;

    @Column(name = "avg_pressure_bar")
    private Double avgPressureBar;

    @Column(name = "avg_load_factor")
    private Double avgLoadFactor;

    @Column(name = "reading_count", nullable = false)
    private int readingCount;

    @Column(name = "refreshed_at")
    private LocalDateTime refreshedAt;
}
