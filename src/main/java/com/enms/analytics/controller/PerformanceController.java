package com.enms.analytics.controller;

import com.enms.analytics.baseline.BaselineService;
import com.enms.analytics.baseline.TargetType;
import com.enms.analytics.performance.EnergyPerformanceEngine;
import com.enms.analytics.performance.KpiService;
import com.enms.analytics.performance.KpiSummary;
import com.enms.analytics.performance.PerformanceAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/v1/performance")
@Slf4j
public class PerformanceController {

    private final EnergyPerformanceEngine performanceEngine;
    private final KpiService kpiService;
    private final BaselineService baselineService;
    private final Clock clock;

    public PerformanceController(EnergyPerformanceEngine performanceEngine,
                                 KpiService kpiService,
                                 BaselineService baselineService,
                                 Clock clock) {
        this.performanceEngine = performanceEngine;
        this.kpiService = kpiService;
        this.baselineService = baselineService;
        this.clock = clock;
    }

    /**
     * Performance report for one SEU and day; the current day when no date is given.
     */
    @GetMapping("/{seuName}")
    public ResponseEntity<PerformanceAnalysis> analyze(
            @PathVariable String seuName,
            @RequestParam String energySource,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        LocalDate day = date != null ? date : LocalDate.now(clock);
        log.info("Performance analysis requested for {} ({}) on {}", seuName, energySource, day);
        return ResponseEntity.ok(performanceEngine.analyze(seuName, energySource, day));
    }

    @GetMapping("/kpis")
    public ResponseEntity<KpiSummary> kpis(
            @RequestParam TargetType targetType,
            @RequestParam String targetId,
            @RequestParam String energySource,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to) {
        return ResponseEntity.ok(kpiService.calculate(
                baselineService.resolveEquipment(targetType, targetId), energySource, from, to));
    }
}
