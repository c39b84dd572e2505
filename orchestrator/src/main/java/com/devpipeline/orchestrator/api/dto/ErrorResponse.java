package com.devpipeline.orchestrator.api.dto;

import java.time.Instant;

/**
 * Error body for every non-2xx response. {@code exitCode} is 3 (internal
 * error) for 5xx responses and null otherwise.
 */
public record ErrorResponse(String error, String message, Integer exitCode, Instant timestamp) {

    public static final int INTERNAL_ERROR_EXIT_CODE = 3;

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null, Instant.now());
    }

    public static ErrorResponse internal(String error, String message) {
        return new ErrorResponse(error, message, INTERNAL_ERROR_EXIT_CODE, Instant.now());
    }
}
