package com.phillippitts.groundstation.presentation.exception;

import com.phillippitts.groundstation.exception.BrokerConnectionException;
import com.phillippitts.groundstation.exception.BrokerNotConnectedException;
import com.phillippitts.groundstation.exception.InvalidTokenException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Missing or wrong token (HTTP 401).
     */
    @ExceptionHandler(InvalidTokenException.class)
    ResponseEntity<ApiError> handleInvalidToken(InvalidTokenException ex) {
        LOG.warn("Rejected request with invalid user token");
        return ResponseEntity
            .status(HttpStatus.UNAUTHORIZED)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid token",
                "Provide a valid user-token header",
                Instant.now()
            ));
    }

    /**
     * Client error - body fails validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String fields = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        LOG.warn("Invalid request body: {}", fields);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("InvalidRequest", "Invalid request body", fields, Instant.now()));
    }

    /**
     * Client error - body is not JSON of the expected shape (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("InvalidRequest", "Malformed request body", "Expected JSON with text and device_id",
                Instant.now()));
    }

    /**
     * Transient error - broker down, retry possible (HTTP 503).
     */
    @ExceptionHandler({BrokerNotConnectedException.class, BrokerConnectionException.class})
    ResponseEntity<ApiError> handleBrokerUnavailable(RuntimeException ex) {
        LOG.error("Broker unavailable: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Message broker temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
