package com.planrunner.api;

import com.planrunner.orchestration.exception.PlanAlreadyRunningException;
import com.planrunner.orchestration.exception.PlanValidationException;
import com.planrunner.orchestration.exception.ReasoningException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JSON error bodies for the task API. Validation problems are the caller's fault (400),
 * model failures are an upstream fault (502).
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(PlanValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(PlanValidationException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "validation-error", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "validation-error", message, request);
    }

    @ExceptionHandler(ReasoningException.class)
    public ResponseEntity<Map<String, Object>> handleReasoning(ReasoningException ex, HttpServletRequest request) {
        log.warn("Reasoning failure on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "reasoning-error", ex.getMessage(), request);
    }

    @ExceptionHandler(PlanAlreadyRunningException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(PlanAlreadyRunningException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "plan-already-running", ex.getMessage(), request);
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String code, String message,
                                                               HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", message);
        body.put("path", request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
