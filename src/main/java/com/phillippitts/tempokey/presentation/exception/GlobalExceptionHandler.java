package com.phillippitts.tempokey.presentation.exception;

import com.phillippitts.tempokey.exception.DetectionUnavailableException;
import com.phillippitts.tempokey.exception.InvalidRequestException;
import com.phillippitts.tempokey.exception.PermissionDeniedException;
import com.phillippitts.tempokey.exception.ProviderUnavailableException;
import com.phillippitts.tempokey.exception.TempoKeyException;
import com.phillippitts.tempokey.exception.TrackNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps domain exceptions to HTTP responses at the REST boundary.
 *
 * Client mistakes are logged at WARN without stack traces; upstream and unexpected failures
 * at ERROR. Internal details never reach the response body.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - bad input (HTTP 400).
     */
    @ExceptionHandler(InvalidRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidRequestException ex) {
        LOG.warn("Invalid request: field={}, reason={}", ex.getField(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", details);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleUnreadable(Exception ex) {
        LOG.warn("Unreadable request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", "Malformed request body or parameter");
    }

    @ExceptionHandler(PermissionDeniedException.class)
    ResponseEntity<ApiError> handlePermissionDenied(PermissionDeniedException ex) {
        LOG.warn("Permission denied: {}", ex.getMessage());
        return error(HttpStatus.FORBIDDEN, ex, "Forbidden", ex.getMessage());
    }

    @ExceptionHandler(TrackNotFoundException.class)
    ResponseEntity<ApiError> handleTrackNotFound(TrackNotFoundException ex) {
        LOG.info("Track not found: {}", ex.getTrackId());
        return error(HttpStatus.NOT_FOUND, ex, "Track not found", ex.getMessage());
    }

    /**
     * Transient upstream error - retry possible (HTTP 503).
     */
    @ExceptionHandler(DetectionUnavailableException.class)
    ResponseEntity<ApiError> handleDetectionUnavailable(DetectionUnavailableException ex) {
        LOG.error("Detection service unavailable: status={}, retryable={}",
                ex.getStatusCode(), ex.isRetryable(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex,
                "Detection service temporarily unavailable",
                ex.isRetryable() ? "Please retry later" : "Detection service is not available");
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    ResponseEntity<ApiError> handleProviderUnavailable(ProviderUnavailableException ex) {
        LOG.error("Preview provider unavailable: provider={}", ex.getProvider(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex,
                "Preview provider temporarily unavailable", "Please retry later");
    }

    @ExceptionHandler(TempoKeyException.class)
    ResponseEntity<ApiError> handleDomain(TempoKeyException ex) {
        LOG.error("Request failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex, "Request failed", "Contact administrator if this persists");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex,
                "An unexpected error occurred", "Contact administrator if this persists");
    }

    private static String describe(FieldError fe) {
        return fe.getField() + ": " + fe.getDefaultMessage();
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    private record ApiError(String errorCode, String message, String details, Instant timestamp) { }
}
