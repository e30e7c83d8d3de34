package com.enms.analytics.scheduler;

import com.enms.analytics.aggregate.AggregateStore;
import com.enms.analytics.aggregate.Resolution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps the rollup tables current. Each resolution is rebuilt from raw readings over a
 * trailing window, so late readings are picked up on the next run.
 */
@Component
@Slf4j
public class AggregateRefreshScheduler {

    private final AggregateStore aggregateStore;
    private final Clock clock;
    private final Duration fineWindow;
    private final Duration dailyWindow;

    private final AtomicBoolean refreshInProgress = new AtomicBoolean(false);

    public AggregateRefreshScheduler(AggregateStore aggregateStore,
                                     Clock clock,
                                     @Value("${aggregates.refresh.window-hours:3}") long windowHours,
                                     @Value("${aggregates.refresh.daily-window-days:2}") long dailyWindowDays) {
        this.aggregateStore = aggregateStore;
        this.clock = clock;
        this.fineWindow = Duration.ofHours(windowHours);
        this.dailyWindow = Duration.ofDays(dailyWindowDays);
    }

    // Two minutes past each quarter hour, after ingestion has flushed the interval
    @Scheduled(cron = "${aggregates.refresh.cron:0 2/15 * * * *}")
    public void refreshIntraday() {
        if (!refreshInProgress.compareAndSet(false, true)) {
            log.info("Aggregate refresh in progress, skipping scheduled run");
            return;
        }
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            refresh(Resolution.MINUTE, now.minus(fineWindow), now);
            refresh(Resolution.FIFTEEN_MINUTES, now.minus(fineWindow), now);
            refresh(Resolution.HOURLY, now.minus(fineWindow), now);
        } finally {
            refreshInProgress.set(false);
        }
    }

    @Scheduled(cron = "${aggregates.refresh.daily-cron:0 10 0 * * *}")
    public void refreshDaily() {
        if (!refreshInProgress.compareAndSet(false, true)) {
            log.info("Aggregate refresh in progress, skipping daily rollup");
            return;
        }
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            refresh(Resolution.DAILY, now.minus(dailyWindow), now);
        } finally {
            refreshInProgress.set(false);
        }
    }

    private void refresh(Resolution resolution, LocalDateTime from, LocalDateTime to) {
        try {
            int rows = aggregateStore.refresh(resolution, from, to);
            log.debug("Refreshed {} {} rollup rows", rows, resolution);
        } catch (Exception e) {
            log.error("Error refreshing {} rollups: {}", resolution, e.getMessage());
        }
    }
}
