package com.phillippitts.observability.service.storage;

import com.phillippitts.observability.domain.MetricSample;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.distribution.CountAtBucket;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class MicrometerMetricsStorageTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final Map<String, String> LABELS = Map.of("method", "GET", "path", "/health", "status", "200");

    private SimpleMeterRegistry registry;
    private MicrometerMetricsStorage storage;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        storage = new MicrometerMetricsStorage(registry);
    }

    @Test
    void countersAggregatePerLabelSet() {
        for (int i = 0; i < 3; i++) {
            storage.incrementCounter(MetricSample.counter("http_requests_total", LABELS, 1.0, NOW)).join();
        }

        double count = registry.get("http_requests_total")
                .tag("method", "GET").tag("path", "/health").tag("status", "200")
                .counter().count();
        assertThat(count).isEqualTo(3.0);
    }

    @Test
    void histogramExposesFixedBuckets() {
        storage.observeHistogram(MetricSample.histogram("http_request_duration_seconds", LABELS, 0.03, NOW)).join();

        DistributionSummary summary = registry.get("http_request_duration_seconds").summary();
        CountAtBucket[] buckets = summary.takeSnapshot().histogramCounts();

        assertThat(summary.count()).isEqualTo(1);
        assertThat(buckets).extracting(CountAtBucket::bucket)
                .containsExactly(0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0);
        assertThat(buckets[3].count()).isEqualTo(1.0);
        assertThat(buckets[2].count()).isEqualTo(0.0);
    }

    @Test
    void readReturnsOneSamplePerSeries() {
        storage.incrementCounter(MetricSample.counter("hits", LABELS, 1.0, NOW));
        storage.incrementCounter(MetricSample.counter("hits", LABELS, 1.0, NOW));
        storage.observeHistogram(MetricSample.histogram("latency", LABELS, 0.5, NOW));
        registry.counter("unrelated").increment();

        assertThat(storage.read())
                .extracting(MetricSample::name, MetricSample::type, MetricSample::value)
                .containsExactlyInAnyOrder(
                        tuple("hits", MetricSample.Type.COUNTER, 2.0),
                        tuple("latency", MetricSample.Type.HISTOGRAM, 0.5));
    }
}
