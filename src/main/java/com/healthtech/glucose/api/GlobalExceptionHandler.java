package com.healthtech.glucose.api;

import com.healthtech.glucose.service.AverageQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global exception handler for REST API controllers.
 * Provides consistent error responses across all endpoints.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AverageQueryService.ValidationException.class)
    public ResponseEntity<ErrorResponse> handleServiceValidation(
            AverageQueryService.ValidationException ex,
            WebRequest request) {

        String path = pathOf(request);
        log.warn("Validation error on {}: {}", path, ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(), "VALIDATION_ERROR", ex.getMessage(), path));
    }

    @ExceptionHandler(AverageQueryService.ServiceException.class)
    public ResponseEntity<ErrorResponse> handleServiceException(
            AverageQueryService.ServiceException ex,
            WebRequest request) {

        String path = pathOf(request);
        log.error("Service exception on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE.value(), "SERVICE_ERROR",
            "Stored averages are temporarily unavailable.", path));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex,
            WebRequest request) {

        String path = pathOf(request);
        log.warn("Missing parameter on {}: {}", path, ex.getParameterName());
        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(), "MISSING_PARAMETER",
            String.format("Required parameter '%s' is missing", ex.getParameterName()), path));
    }

    /**
     * Handle type conversion errors (e.g. a date that is not ISO-8601).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request) {

        String path = pathOf(request);
        String expectedType = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";
        log.warn("Type mismatch on {}: {} expected {} but got {}", path, ex.getName(), expectedType, ex.getValue());
        return ResponseEntity.badRequest().body(new ErrorResponse(
            HttpStatus.BAD_REQUEST.value(), "TYPE_MISMATCH",
            String.format("Parameter '%s' must be a valid %s", ex.getName(), expectedType), path));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request) {

        String path = pathOf(request);
        log.error("Unexpected error on {}: {}", path, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR.value(), "INTERNAL_ERROR",
            "An unexpected error occurred.", path));
    }

    private String pathOf(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }
}
