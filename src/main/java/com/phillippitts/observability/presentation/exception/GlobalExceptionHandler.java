package com.phillippitts.observability.presentation.exception;

import com.phillippitts.observability.config.logging.InstrumentationFilter;
import com.phillippitts.observability.service.context.RequestContextHolder;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts exceptions to HTTP responses carrying the request id, so clients can quote it when
 * reporting problems. The instrumentation filter records the resulting status.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - malformed path variable or parameter (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        LOG.warn("Invalid value for parameter {}: {}", ex.getName(), ex.getValue());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "BadRequest",
                "Invalid value for parameter " + ex.getName(),
                currentRequestId(),
                Instant.now()
            ));
    }

    /**
     * No handler for the path (HTTP 404).
     */
    @ExceptionHandler(NoResourceFoundException.class)
    ResponseEntity<ApiError> handleNotFound(NoResourceFoundException ex) {
        LOG.debug("No handler for {}", ex.getResourcePath());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                "NotFound",
                "No such resource",
                currentRequestId(),
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500). The exception is left on the request so the
     * request log entry records it.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        LOG.error("Unexpected error", ex);
        request.setAttribute(InstrumentationFilter.HANDLED_EXCEPTION_ATTRIBUTE, ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                currentRequestId(),
                Instant.now()
            ));
    }

    private static String currentRequestId() {
        return RequestContextHolder.currentId().orElse("");
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String requestId,
        Instant timestamp
    ) {}
}
