package com.lexsched.lexsched_api.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
            "service", "lexsched-api",
            "status", "running",
            "version", "0.0.1",
            "endpoints", Map.of(
                "health", "/api/health",
                "optimize", "POST /api/schedules/optimize",
                "schedule", "/api/schedules/{problemId}",
                "status", "/api/schedules/status/{problemId}",
                "export", "/api/schedules/export/{problemId}"
            ),
            "message", "LexSched API is running. Use /api/health for health check."
        ));
    }
}
