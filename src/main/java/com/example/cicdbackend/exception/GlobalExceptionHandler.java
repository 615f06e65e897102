package com.example.cicdbackend.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Turns every failure into a JSON body of the form {"error": ..., "code": ...}.
 * Store failures are reported as 503 and never retried.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, Object>> handleApiException(ApiException ex) {
        log.warn("{}: {}", ex.getCode(), ex.getMessage());
        return error(ex.getStatus(), ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Bad value for parameter '{}': {}", ex.getName(), ex.getValue());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST",
                String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName()));
    }

    @ExceptionHandler({DataAccessException.class, CannotCreateTransactionException.class})
    public ResponseEntity<Map<String, Object>> handleStoreFailure(RuntimeException ex) {
        log.error("Store unavailable", ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", "Database is unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        // Framework errors (unknown path, wrong method, missing parameter) keep their own status
        if (ex instanceof ErrorResponse framework) {
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            log.warn("Request rejected with {}: {}", status.value(), ex.getMessage());
            return error(status, status.name(), ex.getMessage());
        }
        log.error("Unexpected error occurred", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message, "code", code));
    }
}
