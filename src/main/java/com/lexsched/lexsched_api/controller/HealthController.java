package com.lexsched.lexsched_api.controller;

import java.util.HashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.lexsched.lexsched_api.config.SchedulerProperties;

/**
 * Health check with the effective solver settings.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final SchedulerProperties properties;

    public HealthController(SchedulerProperties properties) {
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "lexsched-api");

        Map<String, Object> solver = new HashMap<>();
        solver.put("backend", "OR-Tools CP-SAT");
        solver.put("timeLimit", properties.getSolver().getTimeLimit().toString());
        solver.put("numWorkers", properties.getSolver().getNumWorkers());
        solver.put("overlapBufferMinutes", properties.getOverlapBufferMinutes());
        health.put("solver", solver);

        return ResponseEntity.ok(health);
    }
}
