package com.phillippitts.observability.config.properties;

import com.phillippitts.observability.service.pipeline.MiddlewareConfig;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Typed properties for request instrumentation ({@code observability.middleware.*}).
 *
 * <p>Unset properties fall back to the {@link MiddlewareConfig} defaults.
 */
@Validated
@ConfigurationProperties(prefix = "observability.middleware")
public class MiddlewareProperties {

    /** Paths never instrumented; a trailing {@code *} matches by prefix. */
    @NotNull
    private final Set<String> excludePaths;

    /** Header carrying the inbound correlation id and echoed on the response. */
    @NotBlank
    private final String requestIdHeader;

    private final boolean logRequests;

    private final boolean recordMetrics;

    @NotBlank
    private final String requestCounterName;

    @NotBlank
    private final String requestHistogramName;

    /** Maximum time allotted to each storage write. */
    @NotNull
    private final Duration writeTimeout;

    /** Route templates such as {@code /users/{id}} used to normalize metric paths. */
    @NotNull
    private final List<String> routeTemplates;

    @ConstructorBinding
    public MiddlewareProperties(Set<String> excludePaths, String requestIdHeader, Boolean logRequests,
                                Boolean recordMetrics, String requestCounterName,
                                String requestHistogramName, Duration writeTimeout,
                                List<String> routeTemplates) {
        this.excludePaths = excludePaths == null ? Set.of() : Set.copyOf(excludePaths);
        this.requestIdHeader = requestIdHeader == null
                ? MiddlewareConfig.DEFAULT_REQUEST_ID_HEADER : requestIdHeader;
        this.logRequests = logRequests == null ? true : logRequests;
        this.recordMetrics = recordMetrics == null ? true : recordMetrics;
        this.requestCounterName = requestCounterName == null
                ? MiddlewareConfig.DEFAULT_COUNTER_NAME : requestCounterName;
        this.requestHistogramName = requestHistogramName == null
                ? MiddlewareConfig.DEFAULT_HISTOGRAM_NAME : requestHistogramName;
        Duration timeout = writeTimeout == null ? MiddlewareConfig.DEFAULT_WRITE_TIMEOUT : writeTimeout;
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("observability.middleware.write-timeout must be positive");
        }
        this.writeTimeout = timeout;
        this.routeTemplates = routeTemplates == null ? List.of() : List.copyOf(routeTemplates);
    }

    /**
     * Converts the bound properties into the pipeline configuration.
     */
    public MiddlewareConfig toConfig() {
        return MiddlewareConfig.builder()
                .excludePaths(excludePaths)
                .requestIdHeader(requestIdHeader)
                .logRequests(logRequests)
                .recordMetrics(recordMetrics)
                .requestCounterName(requestCounterName)
                .requestHistogramName(requestHistogramName)
                .writeTimeout(writeTimeout)
                .routeTemplates(routeTemplates)
                .build();
    }

    public Set<String> getExcludePaths() {
        return excludePaths;
    }

    public String getRequestIdHeader() {
        return requestIdHeader;
    }

    public boolean isLogRequests() {
        return logRequests;
    }

    public boolean isRecordMetrics() {
        return recordMetrics;
    }

    public String getRequestCounterName() {
        return requestCounterName;
    }

    public String getRequestHistogramName() {
        return requestHistogramName;
    }

    public Duration getWriteTimeout() {
        return writeTimeout;
    }

    public List<String> getRouteTemplates() {
        return routeTemplates;
    }
}
