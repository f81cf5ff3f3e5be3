package com.phillippitts.modeestimator.presentation.exception;

import com.phillippitts.modeestimator.exception.ContractViolationException;
import com.phillippitts.modeestimator.exception.IncomparableElementsException;
import com.phillippitts.modeestimator.exception.SequenceTooLargeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * An undetermined mode never reaches this class; it is a normal response.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - elements of mismatched types (HTTP 400).
     */
    @ExceptionHandler(IncomparableElementsException.class)
    ResponseEntity<ApiError> handleIncomparableElements(IncomparableElementsException ex) {
        LOG.warn("Incomparable elements: position={}, expected={}, actual={}",
                ex.getPosition(), ex.getExpectedType().getSimpleName(), ex.getActualType().getSimpleName());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Values must share one comparable type",
                "Value at position " + ex.getPosition() + " is a " + ex.getActualType().getSimpleName()
                    + ", expected " + ex.getExpectedType().getSimpleName(),
                Instant.now()
            ));
    }

    /**
     * Client error - missing values list or inapplicable flag (HTTP 400).
     */
    @ExceptionHandler(ContractViolationException.class)
    ResponseEntity<ApiError> handleContractViolation(ContractViolationException ex) {
        LOG.warn("Contract violation: argument={}, message={}", ex.getArgument(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid estimate request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - payload over the configured limit (HTTP 413).
     */
    @ExceptionHandler(SequenceTooLargeException.class)
    ResponseEntity<ApiError> handleTooLarge(SequenceTooLargeException ex) {
        LOG.warn("Sequence too large: size={}, max={}", ex.getSize(), ex.getMaxSize());
        return ResponseEntity
            .status(HttpStatus.PAYLOAD_TOO_LARGE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Sequence too large",
                "At most " + ex.getMaxSize() + " values per request",
                Instant.now()
            ));
    }

    /**
     * Client error - body is not valid JSON (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "MalformedRequest",
                "Request body could not be parsed",
                "Expected {\"values\": [...]} with optional removeMissing/firstKnown flags",
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
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
