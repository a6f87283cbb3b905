package com.phillippitts.observability.service.pipeline;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable configuration of one {@link InstrumentationPipeline}.
 *
 * @param excludePaths paths never instrumented; a trailing {@code *} matches by prefix
 * @param requestIdHeader header carrying the inbound correlation id
 * @param logRequests whether a request log entry is written
 * @param recordMetrics whether the request counter and histogram are recorded
 * @param requestCounterName name of the request counter
 * @param requestHistogramName name of the request duration histogram
 * @param writeTimeout maximum time allotted to each storage write
 * @param routeTemplates route templates used to normalize metric paths
 */
public record MiddlewareConfig(Set<String> excludePaths,
                               String requestIdHeader,
                               boolean logRequests,
                               boolean recordMetrics,
                               String requestCounterName,
                               String requestHistogramName,
                               Duration writeTimeout,
                               List<String> routeTemplates) {

    public static final String DEFAULT_REQUEST_ID_HEADER = "X-Request-ID";
    public static final String DEFAULT_COUNTER_NAME = "http_requests_total";
    public static final String DEFAULT_HISTOGRAM_NAME = "http_request_duration_seconds";
    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofMillis(500);

    public MiddlewareConfig {
        excludePaths = excludePaths == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(excludePaths));
        requestIdHeader = requireText(requestIdHeader, "requestIdHeader");
        requestCounterName = requireText(requestCounterName, "requestCounterName");
        requestHistogramName = requireText(requestHistogramName, "requestHistogramName");
        Objects.requireNonNull(writeTimeout, "writeTimeout");
        if (writeTimeout.isZero() || writeTimeout.isNegative()) {
            throw new IllegalArgumentException("writeTimeout must be positive");
        }
        routeTemplates = routeTemplates == null ? List.of() : List.copyOf(routeTemplates);
    }

    /**
     * Returns the configuration with every default applied.
     */
    public static MiddlewareConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    /**
     * Fluent builder starting from the defaults.
     */
    public static final class Builder {
        private final Set<String> excludePaths = new LinkedHashSet<>();
        private String requestIdHeader = DEFAULT_REQUEST_ID_HEADER;
        private boolean logRequests = true;
        private boolean recordMetrics = true;
        private String requestCounterName = DEFAULT_COUNTER_NAME;
        private String requestHistogramName = DEFAULT_HISTOGRAM_NAME;
        private Duration writeTimeout = DEFAULT_WRITE_TIMEOUT;
        private final List<String> routeTemplates = new ArrayList<>();

        private Builder() {
        }

        public Builder excludePaths(Collection<String> paths) {
            excludePaths.addAll(paths);
            return this;
        }

        public Builder excludePath(String path) {
            excludePaths.add(path);
            return this;
        }

        public Builder requestIdHeader(String header) {
            this.requestIdHeader = header;
            return this;
        }

        public Builder logRequests(boolean enabled) {
            this.logRequests = enabled;
            return this;
        }

        public Builder recordMetrics(boolean enabled) {
            this.recordMetrics = enabled;
            return this;
        }

        public Builder requestCounterName(String name) {
            this.requestCounterName = name;
            return this;
        }

        public Builder requestHistogramName(String name) {
            this.requestHistogramName = name;
            return this;
        }

        public Builder writeTimeout(Duration timeout) {
            this.writeTimeout = timeout;
            return this;
        }

        public Builder routeTemplates(Collection<String> templates) {
            routeTemplates.addAll(templates);
            return this;
        }

        public MiddlewareConfig build() {
            return new MiddlewareConfig(excludePaths, requestIdHeader, logRequests, recordMetrics,
                    requestCounterName, requestHistogramName, writeTimeout, routeTemplates);
        }
    }
}
