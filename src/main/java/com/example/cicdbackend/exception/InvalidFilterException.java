package com.example.cicdbackend.exception;

import org.springframework.http.HttpStatus;

/**
 * Query parameter outside its allowed values (HTTP 400).
 */
public class InvalidFilterException extends ApiException {

    public InvalidFilterException(String code, String message) {
        super(code, message, HttpStatus.BAD_REQUEST);
    }

    public static InvalidFilterException unknownValue(String parameter, String value, String allowed) {
        return new InvalidFilterException("INVALID_FILTER",
                String.format("Invalid %s '%s'. Expected one of: %s", parameter, value, allowed));
    }

    public static InvalidFilterException negativeLimit(int limit) {
        return new InvalidFilterException("INVALID_LIMIT",
                String.format("limit must not be negative, got %d", limit));
    }
}
