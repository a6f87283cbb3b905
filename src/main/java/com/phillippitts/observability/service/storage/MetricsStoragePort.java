package com.phillippitts.observability.service.storage;

import com.phillippitts.observability.domain.MetricSample;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Storage port for metric samples.
 *
 * <p>Aggregation, if any, is the adapter's concern. Implementations must tolerate concurrent
 * calls from many requests.
 */
public interface MetricsStoragePort {

    /**
     * Applies a counter increment.
     *
     * @param sample counter sample
     * @return future completed once the sample is stored
     */
    CompletableFuture<Void> incrementCounter(MetricSample sample);

    /**
     * Records a histogram observation.
     *
     * @param sample histogram sample carrying its bucket boundaries
     * @return future completed once the sample is stored
     */
    CompletableFuture<Void> observeHistogram(MetricSample sample);

    /**
     * Returns the stored samples. Adapters that aggregate return one sample per series.
     */
    List<MetricSample> read();
}
