package com.example.jobtrigger.exception;

import com.example.jobtrigger.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for the Job Scheduling API.
 * Provides consistent error responses across all endpoints.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        var errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(this::formatFieldError)
                .toList();

        log.warn("Validation failed: {}", errors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.error("Validation failed", errors));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(JobAlreadyScheduledException.class)
    public ResponseEntity<ApiResponse<Void>> handleAlreadyScheduled(JobAlreadyScheduledException ex) {
        log.warn("Job already scheduled: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(DuplicateTriggerKeyException.class)
    public ResponseEntity<ApiResponse<Void>> handleDuplicateTrigger(DuplicateTriggerKeyException ex) {
        log.warn("Duplicate trigger: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(ConfiguredTriggerNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleTriggerNotFound(ConfiguredTriggerNotFoundException ex) {
        log.warn("Trigger not configured: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(TriggerProviderLookupException.class)
    public ResponseEntity<ApiResponse<Void>> handleProviderLookup(TriggerProviderLookupException ex) {
        log.error("Trigger provider error: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ApiResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(InvalidTriggerConfigurationException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidConfiguration(InvalidTriggerConfigurationException ex) {
        log.error("Trigger configuration error: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(TriggerRegistrationException.class)
    public ResponseEntity<ApiResponse<Void>> handleRegistration(TriggerRegistrationException ex) {
        log.error("Scheduler error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ApiResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(SchedulingTimeoutException.class)
    public ResponseEntity<ApiResponse<Void>> handleTimeout(SchedulingTimeoutException ex) {
        log.error("Scheduling timed out: {}", ex.getMessage());

        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(ApiResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred. Please try again later."));
    }

    private String formatFieldError(FieldError error) {
        return String.format("%s: %s", error.getField(), error.getDefaultMessage());
    }
}
