package com.enms.analytics.persistence;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Hourly rollup of raw readings.
 */
@Entity
@Table(name = "energy_readings_1h",
        uniqueConstraints = @UniqueConstraint(name = "uk_rollup_1h",
                columnNames = {"equipment_id", "energy_type", "bucket_start"}))
public class ReadingRollupHourlyEntity extends ReadingRollup {
}
