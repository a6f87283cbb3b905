package com.phillippitts.observability.service.pipeline;

import com.phillippitts.observability.domain.LogEntry;
import com.phillippitts.observability.domain.LogLevel;
import com.phillippitts.observability.service.context.LogContext;
import com.phillippitts.observability.service.metrics.MetricRecorder;
import com.phillippitts.observability.service.path.RequestPathMatcher;
import com.phillippitts.observability.service.storage.LogStoragePort;
import com.phillippitts.observability.service.write.TimedWriter;
import com.phillippitts.observability.service.write.WriteDiagnostics;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Finalization step of the pipeline: turns a {@link RequestOutcome} into one log entry and the
 * request counter/histogram samples, each written through the {@link TimedWriter}.
 *
 * <p>The three writes are started together and are independent of each other: a failing or
 * slow metrics write never skips or delays the log write beyond its own timeout, and vice versa.
 * Non-completed outcomes are handed to {@link WriteDiagnostics}.
 */
class RequestTelemetryEmitter {

    static final String KIND_LOG = "log";
    static final String KIND_COUNTER = "counter";
    static final String KIND_HISTOGRAM = "histogram";

    private final MiddlewareConfig config;
    private final LogStoragePort logStorage;
    private final MetricRecorder metricRecorder;
    private final TimedWriter writer;
    private final WriteDiagnostics diagnostics;
    private final RequestPathMatcher pathMatcher;
    private final Clock clock;

    RequestTelemetryEmitter(MiddlewareConfig config,
                            LogStoragePort logStorage,
                            MetricRecorder metricRecorder,
                            TimedWriter writer,
                            WriteDiagnostics diagnostics,
                            RequestPathMatcher pathMatcher,
                            Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.logStorage = Objects.requireNonNull(logStorage, "logStorage");
        this.metricRecorder = Objects.requireNonNull(metricRecorder, "metricRecorder");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.pathMatcher = Objects.requireNonNull(pathMatcher, "pathMatcher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts every enabled emission for a finished request.
     *
     * @return future completed when all emissions have ended (each within the write timeout)
     */
    CompletableFuture<Void> emit(RequestOutcome outcome) {
        String requestId = outcome.context().id();
        String route = resolveRoute(outcome.request());
        List<CompletableFuture<Void>> writes = new ArrayList<>(3);

        if (config.logRequests()) {
            LogEntry entry = buildLogEntry(outcome, route);
            writes.add(bounded(KIND_LOG, requestId, () -> logStorage.write(entry)));
        }
        if (config.recordMetrics()) {
            Map<String, String> labels = MetricRecorder.requestLabels(
                    outcome.request().method(), route, outcome.statusCode());
            writes.add(bounded(KIND_COUNTER, requestId,
                    () -> metricRecorder.incrementCounter(config.requestCounterName(), labels)));
            writes.add(bounded(KIND_HISTOGRAM, requestId,
                    () -> metricRecorder.observeHistogram(config.requestHistogramName(), labels,
                            outcome.durationSeconds())));
        }
        return CompletableFuture.allOf(writes.toArray(CompletableFuture[]::new));
    }

    LogEntry buildLogEntry(RequestOutcome outcome, String route) {
        InboundRequest request = outcome.request();
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(LogContext.REQUEST_ID, outcome.context().id());
        attributes.put("method", request.method());
        attributes.put("path", request.path());
        attributes.put("route", route);
        attributes.put("status_code", outcome.statusCode());
        attributes.put("duration_ms", outcome.durationMillis());
        outcome.context().attributes().forEach(attributes::putIfAbsent);

        Throwable error = outcome.error();
        String message;
        if (error != null) {
            attributes.put("exception", error.getClass().getName() + ": " + error.getMessage());
            attributes.put("exception_type", error.getClass().getName());
            message = String.format("%s %s failed with %s", request.method(), request.path(),
                    error.getClass().getSimpleName());
        } else {
            message = String.format("%s %s %d", request.method(), request.path(), outcome.statusCode());
        }
        return new LogEntry(clock.instant(), LogLevel.forStatus(outcome.statusCode()), message, attributes);
    }

    private String resolveRoute(InboundRequest request) {
        String template = request.routeTemplate().get();
        if (template != null && !template.isBlank()) {
            return template;
        }
        return pathMatcher.normalize(request.path());
    }

    private CompletableFuture<Void> bounded(String kind, String requestId,
                                            Supplier<CompletableFuture<Void>> write) {
        return writer.writeBounded(write, config.writeTimeout())
                .thenAccept(result -> diagnostics.report(kind, result, requestId));
    }
}
