package com.phillippitts.observability.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the storage adapters ({@code observability.storage.*}).
 */
@Validated
@ConfigurationProperties(prefix = "observability.storage")
public class StorageProperties {

    public enum MetricsBackend { MICROMETER, IN_MEMORY }

    /** Maximum number of log entries kept before the oldest is evicted. */
    @Positive
    private final int logCapacity;

    @NotNull
    private final MetricsBackend metricsBackend;

    @ConstructorBinding
    public StorageProperties(Integer logCapacity, MetricsBackend metricsBackend) {
        int capacity = logCapacity == null ? 10_000 : logCapacity;
        if (capacity <= 0) {
            throw new IllegalArgumentException("observability.storage.log-capacity must be positive");
        }
        this.logCapacity = capacity;
        this.metricsBackend = metricsBackend == null ? MetricsBackend.MICROMETER : metricsBackend;
    }

    public int getLogCapacity() {
        return logCapacity;
    }

    public MetricsBackend getMetricsBackend() {
        return metricsBackend;
    }
}
