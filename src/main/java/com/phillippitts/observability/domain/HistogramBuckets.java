package com.phillippitts.observability.domain;

import java.util.List;

/**
 * Fixed histogram bucket boundaries (Prometheus default convention), in seconds.
 *
 * <p>These boundaries are part of the metrics contract. Only histogram names are configurable.
 */
public final class HistogramBuckets {

    /** Upper bounds of every request duration histogram, ending with +Inf. */
    public static final List<Double> DEFAULT = List.of(
            0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0, Double.POSITIVE_INFINITY);

    private HistogramBuckets() {
        // Constants holder
    }

    /**
     * Returns the finite upper bounds of the given boundary list (the implicit +Inf bucket dropped).
     *
     * @param buckets bucket boundaries
     * @return finite boundaries in ascending order
     */
    public static double[] finiteBounds(List<Double> buckets) {
        return buckets.stream()
                .mapToDouble(Double::doubleValue)
                .filter(Double::isFinite)
                .sorted()
                .toArray();
    }
}
