package com.phillippitts.observability.service.storage;

import com.phillippitts.observability.domain.MetricSample;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Keeps every metric sample in memory without aggregation. Suitable for tests and for
 * inspecting exactly what was emitted.
 */
public class InMemoryMetricsStorage implements MetricsStoragePort {

    private final ConcurrentLinkedQueue<MetricSample> samples = new ConcurrentLinkedQueue<>();

    @Override
    public CompletableFuture<Void> incrementCounter(MetricSample sample) {
        samples.add(Objects.requireNonNull(sample, "sample"));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> observeHistogram(MetricSample sample) {
        samples.add(Objects.requireNonNull(sample, "sample"));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public List<MetricSample> read() {
        return samples();
    }

    /**
     * Returns all samples in write order.
     */
    public List<MetricSample> samples() {
        return List.copyOf(samples);
    }

    /**
     * Returns all samples with the given metric name.
     */
    public List<MetricSample> samples(String name) {
        return samples.stream().filter(s -> s.name().equals(name)).toList();
    }

    /**
     * Sums the values of all samples of a series (name plus exact label set).
     */
    public double total(String name, Map<String, String> labels) {
        return samples.stream()
                .filter(s -> s.name().equals(name) && s.labels().equals(labels))
                .mapToDouble(MetricSample::value)
                .sum();
    }
}
