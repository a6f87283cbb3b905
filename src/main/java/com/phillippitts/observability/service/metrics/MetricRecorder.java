package com.phillippitts.observability.service.metrics;

import com.phillippitts.observability.domain.MetricSample;
import com.phillippitts.observability.service.storage.MetricsStoragePort;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Typed emission of counter increments and histogram observations.
 *
 * <p>Builds {@link MetricSample}s (label sets, the fixed histogram buckets) and delegates to a
 * {@link MetricsStoragePort}. It performs no aggregation and has no notion of whether metrics
 * are enabled; that decision belongs to the caller.
 *
 * <p>Standard request labels:
 * <ul>
 *   <li>{@code method} - HTTP method</li>
 *   <li>{@code path} - normalized route template</li>
 *   <li>{@code status} - response status code</li>
 * </ul>
 */
public class MetricRecorder {

    private final MetricsStoragePort storage;
    private final Clock clock;

    public MetricRecorder(MetricsStoragePort storage) {
        this(storage, Clock.systemUTC());
    }

    public MetricRecorder(MetricsStoragePort storage, Clock clock) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Increments a counter by one.
     *
     * @param name counter name
     * @param labels label set
     * @return the storage write
     */
    public CompletableFuture<Void> incrementCounter(String name, Map<String, String> labels) {
        return storage.incrementCounter(MetricSample.counter(name, labels, 1.0, clock.instant()));
    }

    /**
     * Records one histogram observation against the default buckets.
     *
     * @param name histogram name
     * @param labels label set
     * @param value observed value (seconds for request durations)
     * @return the storage write
     */
    public CompletableFuture<Void> observeHistogram(String name, Map<String, String> labels, double value) {
        return storage.observeHistogram(MetricSample.histogram(name, labels, value, clock.instant()));
    }

    /**
     * Builds the standard request label set in {@code method, path, status} order.
     *
     * @param method HTTP method
     * @param path normalized path
     * @param statusCode response status code
     * @return ordered label set
     */
    public static Map<String, String> requestLabels(String method, String path, int statusCode) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("method", method);
        labels.put("path", path);
        labels.put("status", Integer.toString(statusCode));
        return labels;
    }
}
