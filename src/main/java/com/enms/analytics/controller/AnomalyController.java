package com.enms.analytics.controller;

import com.enms.analytics.anomaly.AnomalyFilter;
import com.enms.analytics.anomaly.AnomalyService;
import com.enms.analytics.anomaly.Severity;
import com.enms.analytics.config.DetectionProperties;
import com.enms.analytics.dto.DetectAnomaliesRequest;
import com.enms.analytics.dto.ResolveAnomalyRequest;
import com.enms.analytics.job.BackgroundJobService;
import com.enms.analytics.persistence.AnomalyEntity;
import com.enms.analytics.persistence.TrainingJobEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/anomalies")
@RequiredArgsConstructor
@Slf4j
public class AnomalyController {

    private static final String TRIGGER = "api";

    private final AnomalyService anomalyService;
    private final BackgroundJobService jobService;
    private final DetectionProperties detectionProperties;

    @PostMapping("/detect")
    public ResponseEntity<List<AnomalyEntity>> detect(@Valid @RequestBody DetectAnomaliesRequest request) {
        log.info("Detection requested for {} ({}) {} - {}", request.getEquipmentId(),
                request.getEnergySource(), request.getFrom(), request.getTo());
        return ResponseEntity.ok(jobService.runDetectionSweep(request.getEquipmentId(), request.getEnergySource(),
                request.getFrom(), request.getTo(), request.toThresholds(detectionProperties), TRIGGER));
    }

    @PostMapping("/detect-async")
    public ResponseEntity<TrainingJobEntity> detectAsync(@Valid @RequestBody DetectAnomaliesRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(jobService.submitDetectionSweep(request.getEquipmentId(), request.getEnergySource(),
                        request.getFrom(), request.getTo(), request.toThresholds(detectionProperties), TRIGGER));
    }

    @GetMapping
    public ResponseEntity<List<AnomalyEntity>> recent(
            @RequestParam(required = false) String equipmentId,
            @RequestParam(required = false) Severity severity,
            @RequestParam(required = false) Boolean resolved,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime to,
            @RequestParam(defaultValue = "100") int limit) {
        AnomalyFilter filter = AnomalyFilter.builder()
                .equipmentId(equipmentId)
                .severity(severity)
                .resolved(resolved)
                .from(from)
                .to(to)
                .limit(limit)
                .build();
        return ResponseEntity.ok(anomalyService.getRecentAnomalies(filter));
    }

    @GetMapping("/active")
    public ResponseEntity<List<AnomalyEntity>> active() {
        return ResponseEntity.ok(anomalyService.getActiveAnomalies());
    }

    @PostMapping("/{id}/resolve")
    public ResponseEntity<AnomalyEntity> resolve(@PathVariable Long id,
                                                 @Valid @RequestBody(required = false) ResolveAnomalyRequest request) {
        String note = request != null ? request.getNote() : null;
        return ResponseEntity.ok(anomalyService.resolveAnomaly(id, note));
    }
}
