package com.enms.analytics.controller;

import com.enms.analytics.aggregate.AggregateStore;
import com.enms.analytics.aggregate.BucketRow;
import com.enms.analytics.aggregate.FeatureResolver;
import com.enms.analytics.aggregate.Resolution;
import com.enms.analytics.dto.FeatureSummary;
import com.enms.analytics.exception.InvalidRequestException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Feature discovery, bucketed series and manual rollup refresh.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class TimeSeriesController {

    private final FeatureResolver featureResolver;
    private final AggregateStore aggregateStore;

    @GetMapping("/features/{energySource}")
    public ResponseEntity<List<FeatureSummary>> listFeatures(@PathVariable String energySource) {
        return ResponseEntity.ok(featureResolver.listFeatures(energySource).stream()
                .map(FeatureSummary::from)
                .toList());
    }

    @GetMapping("/timeseries/{equipmentId}")
    public ResponseEntity<List<BucketRow>> getSeries(
            @PathVariable String equipmentId,
            @RequestParam String energySource,
            @RequestParam(defaultValue = "HOURLY") Resolution resolution,
            @RequestParam List<String> features,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        requireWindow(from, to);
        return ResponseEntity.ok(aggregateStore.getSeries(equipmentId, energySource, resolution, features, from, to));
    }

    @PostMapping("/timeseries/refresh")
    public ResponseEntity<Map<String, Object>> refresh(
            @RequestParam Resolution resolution,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        requireWindow(from, to);
        log.info("Manual {} rollup refresh {} - {}", resolution, from, to);
        int rows = aggregateStore.refresh(resolution, from, to);
        return ResponseEntity.ok(Map.of("resolution", resolution, "rows", rows));
    }

    private void requireWindow(LocalDateTime from, LocalDateTime to) {
        if (!from.isBefore(to)) {
            throw new InvalidRequestException("Window start must be before its end");
        }
    }
}
