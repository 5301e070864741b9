package com.smartsched.timetable_engine.controller;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.smartsched.timetable_engine.service.GenerationService;

/**
 * Liveness plus snapshot-store connectivity and job registry size.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

    private final MongoTemplate mongoTemplate;
    private final GenerationService generationService;

    public HealthController(MongoTemplate mongoTemplate, GenerationService generationService) {
        this.mongoTemplate = mongoTemplate;
        this.generationService = generationService;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "timetable-engine");
        health.put("jobs", generationService.jobCount());

        Map<String, Object> mongoStatus = new HashMap<>();
        try {
            mongoStatus.put("database", mongoTemplate.getDb().getName());
            mongoStatus.put("connected", true);
        } catch (Exception e) {
            mongoStatus.put("connected", false);
            mongoStatus.put("error", e.getMessage());
            logger.error("Snapshot store health check failed: {}", e.getMessage());
        }
        health.put("mongodb", mongoStatus);
        return ResponseEntity.ok(health);
    }
}
