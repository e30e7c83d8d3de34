package com.enms.analytics.persistence;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * 1-minute rollup of raw readings.
 */
@Entity
@Table(name = "energy_readings_1m",
        uniqueConstraints = @UniqueConstraint(name = "uk_rollup_1m",
                columnNames = {"equipment_id", "energy_type", "bucket_start"}))
public class ReadingRollupMinuteEntity extends ReadingRollup {
}
