package com.phillippitts.observability.exception;

/**
 * Raised when releasing a request context fails.
 * Logged separately and never allowed to replace a handler exception.
 */
public class ContextCleanupException extends ObservabilityException {

    private final String requestId;

    public ContextCleanupException(String requestId, Throwable cause) {
        super("Failed to release request context " + requestId, cause);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
