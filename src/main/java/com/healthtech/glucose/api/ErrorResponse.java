package com.healthtech.glucose.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Standardized error response for API errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response with details about the failure")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "400")
    int status,

    @Schema(description = "Error type/category", example = "VALIDATION_ERROR")
    String error,

    @Schema(description = "Human-readable error message", example = "Date 2024-03-20 is not complete yet")
    String message,

    @Schema(description = "Request path that caused the error", example = "/api/v1/averages")
    String path,

    @Schema(description = "Timestamp of the error", example = "2024-03-20T10:30:00Z")
    Instant timestamp
) {

    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now());
    }
}
