package com.kidsmap.datablock.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 데이터 블록 API 전역 예외 핸들러
 */
@RestControllerAdvice(basePackages = "com.kidsmap.datablock.controller")
@Slf4j
public class DataBlockExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        Map<String, Object> response = createErrorResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.BAD_REQUEST);
        response.put("violations", ex.getViolations());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(BlockNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(BlockNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return respond(ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler({DuplicateBlockException.class, InvalidTransitionException.class,
            MigrationValidationMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(DataBlockException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return respond(ex, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(TransientNetworkException.class)
    public ResponseEntity<Map<String, Object>> handleTransient(TransientNetworkException ex) {
        log.warn("Upstream unavailable: {}", ex.getMessage());
        return respond(ex, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(MalformedRecordException.class)
    public ResponseEntity<Map<String, Object>> handleMalformed(MalformedRecordException ex) {
        log.warn("Malformed record: {}", ex.getMessage());
        return respond(ex, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(ConfigurationException ex) {
        log.error("Configuration error: {}", ex.getMessage());
        return respond(ex, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(DataBlockException.class)
    public ResponseEntity<Map<String, Object>> handleDataBlock(DataBlockException ex) {
        log.error("Data block error: {}", ex.getMessage(), ex);
        return respond(ex, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBind(WebExchangeBindException ex) {
        List<String> violations = ex.getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .toList();
        Map<String, Object> response = createErrorResponse("VALIDATION_ERROR",
                "Invalid request: " + String.join("; ", violations), HttpStatus.BAD_REQUEST);
        response.put("violations", violations);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        log.debug("Bad request input: {}", ex.getReason());
        Map<String, Object> response = createErrorResponse("VALIDATION_ERROR",
                ex.getReason() != null ? ex.getReason() : "Invalid request", HttpStatus.BAD_REQUEST);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        Map<String, Object> response = createErrorResponse("INTERNAL_ERROR",
                "An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    private ResponseEntity<Map<String, Object>> respond(DataBlockException ex, HttpStatus status) {
        return ResponseEntity.status(status).body(createErrorResponse(ex.getErrorCode(), ex.getMessage(), status));
    }

    private Map<String, Object> createErrorResponse(String errorCode, String message, HttpStatus status) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status.value());
        response.put("timestamp", LocalDateTime.now().toString());
        return response;
    }
}
