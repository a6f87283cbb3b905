package com.phillippitts.observability.exception;

/**
 * Base exception for all errors raised by the observability layer itself.
 * Application (handler) exceptions never extend this class; they cross the pipeline unchanged.
 */
public class ObservabilityException extends RuntimeException {

    public ObservabilityException(String message) {
        super(message);
    }

    public ObservabilityException(String message, Throwable cause) {
        super(message, cause);
    }

    public ObservabilityException(Throwable cause) {
        super(cause);
    }
}
