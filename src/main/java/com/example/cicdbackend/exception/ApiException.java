package com.example.cicdbackend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base class for failures that map to a specific HTTP status.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final String code;
    private final HttpStatus status;

    protected ApiException(String code, String message, HttpStatus status) {
        super(message);
        this.code = code;
        this.status = status;
    }
}
