package com.dependency.flow.maestro.controller;

import com.dependency.flow.maestro.exception.CodeFlowServiceException;
import com.dependency.flow.maestro.exception.RepositoryHostException;
import com.dependency.flow.maestro.exception.SubscriptionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.OffsetDateTime;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SubscriptionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleSubscriptionNotFound(SubscriptionNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "SUBSCRIPTION_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(RepositoryHostException.class)
    public ResponseEntity<Map<String, Object>> handleRepositoryHost(RepositoryHostException ex) {
        log.error("Repository host call failed: {}", ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, "REPOSITORY_HOST_FAILURE", ex.getMessage());
    }

    @ExceptionHandler(CodeFlowServiceException.class)
    public ResponseEntity<Map<String, Object>> handleCodeFlowService(CodeFlowServiceException ex) {
        log.error("Code flow service call failed: {}", ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, "CODE_FLOW_SERVICE_FAILURE", ex.getMessage());
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<Map<String, Object>> handleConcurrentUpdate(OptimisticLockingFailureException ex) {
        log.warn("Concurrent updater state change: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "CONCURRENT_UPDATE", "Updater state was changed concurrently, retry the request");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", message);
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = Map.of(
                "timestamp", OffsetDateTime.now().toString(),
                "error", error,
                "message", message == null ? "" : message
        );
        return ResponseEntity.status(status).body(body);
    }
}
