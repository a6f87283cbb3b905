package com.phillippitts.observability.service.storage;

import com.phillippitts.observability.domain.HistogramBuckets;
import com.phillippitts.observability.domain.MetricSample;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics storage backed by a Micrometer {@link MeterRegistry}.
 *
 * <p>Counters map to {@link Counter}s; histogram samples map to {@link DistributionSummary}s
 * whose service level objectives are the sample's finite bucket boundaries, so Prometheus
 * scraping (via {@code /actuator/prometheus}) exposes exactly those {@code le} buckets.
 * Aggregation is done by Micrometer.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
public class MicrometerMetricsStorage implements MetricsStoragePort {

    private final MeterRegistry registry;
    private final Set<String> names = ConcurrentHashMap.newKeySet();

    public MicrometerMetricsStorage(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public CompletableFuture<Void> incrementCounter(MetricSample sample) {
        names.add(sample.name());
        Counter.builder(sample.name())
                .description("Counter emitted by request instrumentation")
                .tags(tags(sample.labels()))
                .register(registry)
                .increment(sample.value());
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> observeHistogram(MetricSample sample) {
        names.add(sample.name());
        List<Double> buckets = sample.buckets().isEmpty() ? HistogramBuckets.DEFAULT : sample.buckets();
        DistributionSummary.builder(sample.name())
                .description("Histogram emitted by request instrumentation")
                .serviceLevelObjectives(HistogramBuckets.finiteBounds(buckets))
                .tags(tags(sample.labels()))
                .register(registry)
                .record(sample.value());
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Returns one aggregated sample per registered series: the running count for counters and
     * the total recorded amount for histograms.
     */
    @Override
    public List<MetricSample> read() {
        Instant now = Instant.now();
        List<MetricSample> result = new ArrayList<>();
        for (Meter meter : registry.getMeters()) {
            String name = meter.getId().getName();
            if (!names.contains(name)) {
                continue;
            }
            Map<String, String> labels = new LinkedHashMap<>();
            meter.getId().getTags().forEach(tag -> labels.put(tag.getKey(), tag.getValue()));
            if (meter instanceof Counter counter) {
                result.add(MetricSample.counter(name, labels, counter.count(), now));
            } else if (meter instanceof DistributionSummary summary) {
                result.add(MetricSample.histogram(name, labels, summary.totalAmount(), now));
            }
        }
        return result;
    }

    private static List<Tag> tags(Map<String, String> labels) {
        List<Tag> tags = new ArrayList<>(labels.size());
        labels.forEach((key, value) -> tags.add(Tag.of(key, value == null ? "" : value)));
        return tags;
    }
}
