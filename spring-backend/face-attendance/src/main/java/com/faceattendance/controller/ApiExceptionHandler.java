package com.faceattendance.controller;

import com.faceattendance.exception.AttendanceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;
import java.util.Map;

/**
 * Maps engine failures to HTTP statuses with a {@code {"detail": ...}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AttendanceException.class)
    public ResponseEntity<Map<String, String>> handleAttendance(AttendanceException e) {
        HttpStatus status;
        switch (e.getErrorCode()) {
            case PROVIDER_TIMEOUT:
                status = HttpStatus.GATEWAY_TIMEOUT;
                break;
            case PROVIDER_FAILURE:
                status = HttpStatus.SERVICE_UNAVAILABLE;
                break;
            case PERSISTENCE_FAILURE:
                status = HttpStatus.INTERNAL_SERVER_ERROR;
                break;
            default:
                status = HttpStatus.BAD_REQUEST;
                break;
        }
        if (status.is5xxServerError()) {
            log.error("{}: {}", e.getErrorCode(), e.getMessage(), e);
        } else {
            log.debug("{}: {}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(Map.of("detail", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("detail", e.getMessage()));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, String>> handleConflict(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(Map.of("detail", "User ID already registered"));
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, String>> handleUpload(IOException e) {
        log.warn("Failed to read upload: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("detail", "Failed to read uploaded image"));
    }
}
