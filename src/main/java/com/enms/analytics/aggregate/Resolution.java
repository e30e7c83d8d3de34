package com.enms.analytics.aggregate;

import com.enms.analytics.persistence.ReadingRollup;
import com.enms.analytics.persistence.ReadingRollupDailyEntity;
import com.enms.analytics.persistence.ReadingRollupFifteenMinuteEntity;
import com.enms.analytics.persistence.ReadingRollupHourlyEntity;
import com.enms.analytics.persistence.ReadingRollupMinuteEntity;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.function.Supplier;

/**
 * Fixed set of rollup resolutions. Every resolution is materialized from raw readings.
 */
public enum Resolution {

    MINUTE("1m", Duration.ofMinutes(1), ReadingRollupMinuteEntity.class, ReadingRollupMinuteEntity::new),
    FIFTEEN_MINUTES("15m", Duration.ofMinutes(15), ReadingRollupFifteenMinuteEntity.class,
            ReadingRollupFifteenMinuteEntity::new),
    HOURLY("1h", Duration.ofHours(1), ReadingRollupHourlyEntity.class, ReadingRollupHourlyEntity::new),
    DAILY("1d", Duration.ofDays(1), ReadingRollupDailyEntity.class, ReadingRollupDailyEntity::new);

    private final String suffix;
    private final Duration width;
    private final Class<? extends ReadingRollup> entityClass;
    private final Supplier<? extends ReadingRollup> factory;

    Resolution(String suffix, Duration width, Class<? extends ReadingRollup> entityClass,
               Supplier<? extends ReadingRollup> factory) {
        this.suffix = suffix;
        this.width = width;
        this.entityClass = entityClass;
        this.factory = factory;
    }

    public String getSuffix() {
        return suffix;
    }

    public Duration getWidth() {
        return width;
    }

    public Class<? extends ReadingRollup> getEntityClass() {
        return entityClass;
    }

    public ReadingRollup newRow() {
        return factory.get();
    }

    /**
     * Physical table of a rollup family at this resolution, e.g. {@code energy_readings_1h}.
     */
    public String tableName(String family) {
        return family + "_" + suffix;
    }

    /**
     * Number of buckets in a full day.
     */
    public int bucketsPerDay() {
        return (int) (Duration.ofDays(1).getSeconds() / width.getSeconds());
    }

    /**
     * Start of the bucket containing the given instant (UTC wall time).
     */
    public LocalDateTime bucketStart(LocalDateTime time) {
        long epoch = time.toEpochSecond(ZoneOffset.UTC);
        long widthSeconds = width.getSeconds();
        long start = Math.floorDiv(epoch, widthSeconds) * widthSeconds;
        return LocalDateTime.ofEpochSecond(start, 0, ZoneOffset.UTC);
    }
}
