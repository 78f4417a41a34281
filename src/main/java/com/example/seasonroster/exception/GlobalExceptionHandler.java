package com.example.seasonroster.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new TreeMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(field, error.getDefaultMessage());
        });
        logger.warn("Roster request failed validation: {}", errors);
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "VALIDATION_ERROR", "Request contains invalid fields", errors, LocalDateTime.now()));
    }

    @ExceptionHandler(ScheduleGenerationException.class)
    public ResponseEntity<ErrorResponse> handleScheduleGeneration(ScheduleGenerationException ex) {
        Map<String, String> details = new LinkedHashMap<>();
        if (ex.getParameters().length > 0) {
            details.put("parameters", Arrays.toString(ex.getParameters()));
        }
        logger.warn("Roster generation rejected [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                ex.getErrorCode(), ex.getMessage(), details.isEmpty() ? null : details, LocalDateTime.now()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        logger.warn("Unreadable roster request: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "MALFORMED_REQUEST", ex.getMostSpecificCause().getMessage(), null, LocalDateTime.now()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        logger.warn("Invalid argument: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
                "INVALID_ARGUMENT", ex.getMessage(), null, LocalDateTime.now()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        logger.error("Unexpected error while handling roster request", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
                "INTERNAL_ERROR", "Unexpected error", null, LocalDateTime.now()));
    }

    public record ErrorResponse(
            String error,
            String message,
            Map<String, String> details,
            LocalDateTime timestamp
    ) {}
}
