package com.enms.analytics.persistence;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * 15-minute rollup of raw readings.
 */
@Entity
@Table(name = "energy_readings_15m",
        uniqueConstraints = @UniqueConstraint(name = "uk_rollup_15m",
                columnNames = {"equipment_id", "energy_type", "bucket_start"}))
public class ReadingRollupFifteenMinuteEntity extends ReadingRollup {
}
