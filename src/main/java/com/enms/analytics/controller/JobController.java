package com.enms.analytics.controller;

import com.enms.analytics.job.TrainingJobService;
import com.enms.analytics.persistence.TrainingJobEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
public class JobController {

    private final TrainingJobService jobService;

    @GetMapping("/{id}")
    public ResponseEntity<TrainingJobEntity> getJob(@PathVariable Long id) {
        return ResponseEntity.ok(jobService.getJob(id));
    }

    @GetMapping
    public ResponseEntity<List<TrainingJobEntity>> recentJobs() {
        return ResponseEntity.ok(jobService.getRecentJobs());
    }
}
