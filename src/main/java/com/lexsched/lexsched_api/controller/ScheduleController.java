package com.lexsched.lexsched_api.controller;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.lexsched.lexsched_api.dto.OptimizationRequest;
import com.lexsched.lexsched_api.dto.ScheduleResponse;
import com.lexsched.lexsched_api.model.ScheduleRun;
import com.lexsched.lexsched_api.service.ExcelExportService;
import com.lexsched.lexsched_api.service.SchedulingService;

import jakarta.servlet.http.HttpServletResponse;

@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

    private static final Logger logger = LoggerFactory.getLogger(ScheduleController.class);

    private final SchedulingService schedulingService;
    private final ExcelExportService excelExportService;

    public ScheduleController(SchedulingService schedulingService, ExcelExportService excelExportService) {
        this.schedulingService = schedulingService;
        this.excelExportService = excelExportService;
    }

    /**
     * Solves synchronously. Failures surface through {@code GlobalExceptionHandler} and are
     * also recorded as FAILED runs.
     */
    @PostMapping("/optimize")
    public ResponseEntity<ScheduleResponse> optimize(@RequestBody OptimizationRequest request) {
        logger.info(">>> Received /optimize request.");
        ScheduleRun run = schedulingService.optimize(request);
        return ResponseEntity.ok(ScheduleResponse.from(run));
    }

    @GetMapping("/{problemId}")
    public ResponseEntity<ScheduleResponse> getSchedule(@PathVariable String problemId) {
        logger.debug(">>> Received schedule request for problemId: {}", problemId);
        return ResponseEntity.ok(ScheduleResponse.from(schedulingService.getRun(problemId)));
    }

    @GetMapping("/status/{problemId}")
    public ResponseEntity<Map<String, String>> getStatus(@PathVariable String problemId) {
        logger.debug(">>> Received status check request for problemId: {}", problemId);
        return ResponseEntity.ok(Map.of("problemId", problemId,
                "status", schedulingService.getRunStatus(problemId).name()));
    }

    @GetMapping("/export/{problemId}")
    public void export(@PathVariable String problemId, HttpServletResponse response) throws IOException {
        logger.info(">>> Received request to export schedule for problemId: {}", problemId);
        ScheduleRun run = schedulingService.getRun(problemId);
        ByteArrayInputStream bis = excelExportService.generateScheduleExcel(run);
        response.setContentType("application/vnd.ms-excel");
        response.setHeader(HttpHeaders.CONTENT_DISPOSITION,
                "attachment; filename=\"" + excelExportService.getExcelFilename(run) + "\"");
        bis.transferTo(response.getOutputStream());
        response.flushBuffer();
        logger.info(">>> Exported schedule for problemId: {}", problemId);
    }
}
