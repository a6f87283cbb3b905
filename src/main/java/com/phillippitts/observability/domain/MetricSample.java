package com.phillippitts.observability.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single metric emission: one counter increment or one histogram observation.
 *
 * @param type counter or histogram
 * @param name metric name, e.g. {@code http_requests_total}
 * @param labels ordered label set
 * @param value increment for counters, observed value for histograms
 * @param timestamp when the sample was produced
 * @param buckets histogram bucket boundaries; empty for counters
 */
public record MetricSample(Type type,
                           String name,
                           Map<String, String> labels,
                           double value,
                           Instant timestamp,
                           List<Double> buckets) {

    /** Kind of metric a sample belongs to. */
    public enum Type { COUNTER, HISTOGRAM }

    public MetricSample {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timestamp, "timestamp");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Metric name must not be blank");
        }
        labels = labels == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        buckets = buckets == null ? List.of() : List.copyOf(buckets);
    }

    /**
     * Creates a counter sample.
     */
    public static MetricSample counter(String name, Map<String, String> labels, double increment, Instant timestamp) {
        return new MetricSample(Type.COUNTER, name, labels, increment, timestamp, List.of());
    }

    /**
     * Creates a histogram observation bucketed against {@link HistogramBuckets#DEFAULT}.
     */
    public static MetricSample histogram(String name, Map<String, String> labels, double value, Instant timestamp) {
        return new MetricSample(Type.HISTOGRAM, name, labels, value, timestamp, HistogramBuckets.DEFAULT);
    }
}
