package com.enms.analytics.controller;

import com.enms.analytics.baseline.BaselineService;
import com.enms.analytics.baseline.TargetType;
import com.enms.analytics.dto.BaselineModelSummary;
import com.enms.analytics.dto.DeviationRequest;
import com.enms.analytics.dto.DeviationResult;
import com.enms.analytics.dto.PredictRequest;
import com.enms.analytics.dto.TrainBaselineRequest;
import com.enms.analytics.job.BackgroundJobService;
import com.enms.analytics.persistence.BaselineModelEntity;
import com.enms.analytics.persistence.TrainingJobEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/baselines")
@RequiredArgsConstructor
@Slf4j
public class BaselineController {

    private static final String TRIGGER = "api";

    private final BaselineService baselineService;
    private final BackgroundJobService jobService;

    @PostMapping("/train")
    public ResponseEntity<BaselineModelSummary> train(@Valid @RequestBody TrainBaselineRequest request) {
        log.info("Training requested for {} {} ({})",
                request.getTargetType(), request.getTargetId(), request.getEnergySource());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(jobService.trainBaseline(request.toTrainingRequest(TRIGGER)));
    }

    /**
     * Queue training and return the job at once; poll {@code /api/v1/jobs/{id}} for the result.
     */
    @PostMapping("/train-async")
    public ResponseEntity<TrainingJobEntity> trainAsync(@Valid @RequestBody TrainBaselineRequest request) {
        log.info("Background training requested for {} {} ({})",
                request.getTargetType(), request.getTargetId(), request.getEnergySource());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(jobService.submitTraining(request.toTrainingRequest(TRIGGER)));
    }

    @GetMapping
    public ResponseEntity<List<BaselineModelSummary>> listModels(@RequestParam TargetType targetType,
                                                                 @RequestParam String targetId) {
        return ResponseEntity.ok(baselineService.listModels(targetType, targetId));
    }

    @GetMapping("/model")
    public ResponseEntity<BaselineModelSummary> getModel(@RequestParam TargetType targetType,
                                                         @RequestParam String targetId,
                                                         @RequestParam String energySource,
                                                         @RequestParam(required = false) Integer version) {
        return ResponseEntity.ok(BaselineModelSummary.from(
                baselineService.getModel(targetType, targetId, energySource, version)));
    }

    @PostMapping("/predict")
    public ResponseEntity<Map<String, Object>> predict(@Valid @RequestBody PredictRequest request) {
        BaselineModelEntity model = baselineService.getModel(request.getTargetType(), request.getTargetId(),
                request.getEnergySource(), request.getVersion());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("modelVersion", model.getVersion());
        body.put("qualityTier", model.getQualityTier());
        body.put("predicted", baselineService.predict(model, request.getFeatures()));
        return ResponseEntity.ok(body);
    }

    @PostMapping("/deviation")
    public ResponseEntity<DeviationResult> deviation(@Valid @RequestBody DeviationRequest request) {
        BaselineModelEntity model = baselineService.getModel(request.getTargetType(), request.getTargetId(),
                request.getEnergySource(), request.getVersion());
        return ResponseEntity.ok(baselineService.deviation(model, request.getActual(), request.getFeatures()));
    }
}
