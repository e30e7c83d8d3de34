package com.enms.analytics.persistence;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Daily rollup of raw readings.
 */
@Entity
@Table(name = "energy_readings_1d",
        uniqueConstraints = @UniqueConstraint(name = "uk_rollup_1d",
                columnNames = {"equipment_id", "energy_type", "bucket_start"}))
public class ReadingRollupDailyEntity extends ReadingRollup {
}
