package com.lexsched.lexsched_api.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps scheduler failures to JSON error bodies of the form {@code {"message": ..., ...}}.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private ResponseEntity<Object> buildErrorResponse(Exception ex, HttpStatus status) {
        logger.error("Exception caught by GlobalExceptionHandler: {}", ex.getMessage());
        return ResponseEntity.status(status).body(Map.of("message", ex.getMessage()));
    }

    // --- 404 Not Found ---
    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Object> handleNoSuchElementException(NoSuchElementException ex, WebRequest request) {
        logger.warn("Resource not found: {}", ex.getMessage());
        return buildErrorResponse(ex, HttpStatus.NOT_FOUND);
    }

    // --- 400 Bad Request ---
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Object> handleIllegalArgumentException(IllegalArgumentException ex, WebRequest request) {
        logger.warn("Bad request: {}", ex.getMessage());
        return buildErrorResponse(ex, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(CatalogLoadException.class)
    public ResponseEntity<Object> handleCatalogLoadException(CatalogLoadException ex, WebRequest request) {
        logger.warn("Catalog rejected: {}", ex.getViolations());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", ex.getMessage());
        body.put("violations", ex.getViolations());
        if (ex.getProblemId() != null) {
            body.put("problemId", ex.getProblemId());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    // --- 422 / 504 / 500 stage failures ---
    @ExceptionHandler(OptimizationFailureException.class)
    public ResponseEntity<Object> handleOptimizationFailure(OptimizationFailureException ex, WebRequest request) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            logger.error("Optimization failed at stage {}:", ex.getStageIndex(), ex);
        } else {
            logger.warn("Optimization failed at stage {}: {}", ex.getStageIndex(), ex.getMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", ex.getMessage());
        body.put("kind", ex.getKind());
        if (ex.getProblemId() != null) {
            body.put("problemId", ex.getProblemId());
        }
        body.put("stage", ex.getStageIndex());
        if (ex.getObjectiveName() != null) {
            body.put("objective", ex.getObjectiveName());
        }
        body.put("completedStages", ex.getCompletedStages().stream()
                .map(s -> Map.of("stage", s.getIndex(), "objective", s.getObjectiveName(), "value", s.getAchievedValue()))
                .collect(Collectors.toList()));
        if (ex instanceof StagedInfeasibilityException && ((StagedInfeasibilityException) ex).getFrozenBound() != null) {
            body.put("frozenBound", ((StagedInfeasibilityException) ex).getFrozenBound().toString());
        }
        return ResponseEntity.status(status).body(body);
    }

    private static HttpStatus statusFor(OptimizationFailureException ex) {
        if (ex instanceof SolverTimeoutException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        if (ex instanceof PluginEvaluationException) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }

    // --- 500 for runs aborted by an unexpected error ---
    @ExceptionHandler(SchedulingException.class)
    public ResponseEntity<Object> handleSchedulingException(SchedulingException ex, WebRequest request) {
        logger.error("Scheduling run failed: {}", ex.getMessage(), ex.getCause());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", ex.getMessage());
        if (ex.getProblemId() != null) {
            body.put("problemId", ex.getProblemId());
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    // --- 500 Internal Server Error (Generic Fallback) ---
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleAllUncaughtException(Exception ex, WebRequest request) {
        logger.error("An unexpected internal server error occurred:", ex);
        return buildErrorResponse(new RuntimeException("An unexpected internal error occurred."),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
