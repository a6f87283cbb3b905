package com.phillippitts.observability.exception;

/**
 * Thrown by a log or metrics storage adapter when a write cannot be accepted.
 * Always contained by the pipeline and reported on the diagnostics channel.
 */
public class StorageWriteException extends ObservabilityException {

    private final String storageName;

    public StorageWriteException(String message, String storageName) {
        super(message + " (storage: " + storageName + ")");
        this.storageName = storageName;
    }

    public StorageWriteException(String message, String storageName, Throwable cause) {
        super(message + " (storage: " + storageName + ")", cause);
        this.storageName = storageName;
    }

    public String getStorageName() {
        return storageName;
    }
}
