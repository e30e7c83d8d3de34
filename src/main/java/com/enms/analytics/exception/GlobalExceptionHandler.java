package com.enms.analytics.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(TrainingInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleTrainingInProgress(TrainingInProgressException ex) {
        log.info("Rejected request: {}", ex.getMessage());
        Map<String, Object> body = buildBody(ex.getKind().getStatus(), ex.getKind().name(), ex.getMessage());
        body.put("activeJobId", ex.getActiveJobId());
        return ResponseEntity.status(ex.getKind().getStatus()).body(body);
    }

    @ExceptionHandler(AnalyticsException.class)
    public ResponseEntity<Map<String, Object>> handleAnalyticsException(AnalyticsException ex) {
        log.debug("Request failed with {}: {}", ex.getKind(), ex.getMessage());
        return ResponseEntity.status(ex.getKind().getStatus())
                .body(buildBody(ex.getKind().getStatus(), ex.getKind().name(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                errors.put(error.getField(), error.getDefaultMessage())
        );

        Map<String, Object> body = buildBody(HttpStatus.BAD_REQUEST,
                ErrorKind.INVALID_REQUEST.name(), "Validation failed");
        body.put("errors", errors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadArgument(Exception ex) {
        return ResponseEntity.badRequest()
                .body(buildBody(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_REQUEST.name(), ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildBody(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                        "An unexpected error occurred"));
    }

    private Map<String, Object> buildBody(HttpStatus status, String kind, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("kind", kind);
        body.put("message", message);
        return body;
    }
}
