package com.smartsched.timetable_engine.controller;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.smartsched.timetable_engine.dto.GenerationRequest;
import com.smartsched.timetable_engine.dto.GenerationResultResponse;
import com.smartsched.timetable_engine.dto.ProgressResponse;
import com.smartsched.timetable_engine.dto.SnapshotGenerationRequest;
import com.smartsched.timetable_engine.service.GenerationService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/generation")
@RequiredArgsConstructor
public class GenerationController {

    private static final Logger logger = LoggerFactory.getLogger(GenerationController.class);

    private final GenerationService generationService;

    @PostMapping
    public ResponseEntity<Map<String, String>> submit(@RequestBody GenerationRequest request) {
        String jobId = generationService.submit(request);
        logger.info("Accepted generation request as job {}", jobId);
        return ResponseEntity.accepted().body(Map.of("message", "Timetable generation started.", "jobId", jobId));
    }

    @PostMapping("/snapshot")
    public ResponseEntity<Map<String, String>> submitSnapshot(@RequestBody SnapshotGenerationRequest request) {
        String jobId = generationService.submitSnapshot(request);
        logger.info("Accepted snapshot generation for {}/{}/{} as job {}", request.organizationId(),
                request.semester(), request.academicYear(), jobId);
        return ResponseEntity.accepted().body(Map.of("message", "Timetable generation started.", "jobId", jobId));
    }

    @GetMapping("/{jobId}/progress")
    public ResponseEntity<ProgressResponse> getProgress(@PathVariable String jobId) {
        return ResponseEntity.ok(generationService.getProgress(jobId));
    }

    @GetMapping("/{jobId}/result")
    public ResponseEntity<GenerationResultResponse> getResult(@PathVariable String jobId) {
        return ResponseEntity.ok(generationService.getResult(jobId));
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String jobId) {
        generationService.cancel(jobId);
        return ResponseEntity.accepted().body(Map.of("message", "Cancellation requested.", "jobId", jobId));
    }
}
