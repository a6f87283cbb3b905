package com.phillippitts.observability.service.pipeline;

import com.phillippitts.observability.domain.LogEntry;
import com.phillippitts.observability.domain.LogLevel;
import com.phillippitts.observability.domain.MetricSample;
import com.phillippitts.observability.service.context.LogContext;
import com.phillippitts.observability.service.context.RequestContextHolder;
import com.phillippitts.observability.service.storage.InMemoryLogStorage;
import com.phillippitts.observability.service.storage.InMemoryMetricsStorage;
import com.phillippitts.observability.service.storage.LogStoragePort;
import com.phillippitts.observability.service.write.TimedWriter;
import com.phillippitts.observability.service.write.WriteDiagnostics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InstrumentationPipelineTest {

    private static final String COUNTER = MiddlewareConfig.DEFAULT_COUNTER_NAME;
    private static final String HISTOGRAM = MiddlewareConfig.DEFAULT_HISTOGRAM_NAME;

    private ExecutorService telemetryExecutor;
    private InMemoryLogStorage logStorage;
    private InMemoryMetricsStorage metricsStorage;
    private SimpleMeterRegistry registry;
    private WriteDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        telemetryExecutor = Executors.newFixedThreadPool(4);
        logStorage = new InMemoryLogStorage();
        metricsStorage = new InMemoryMetricsStorage();
        registry = new SimpleMeterRegistry();
        diagnostics = new WriteDiagnostics(registry);
    }

    @AfterEach
    void tearDown() {
        telemetryExecutor.shutdownNow();
    }

    @Test
    void repeatedRequestsAccumulateOneCounterSeries() throws Exception {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.defaults());

        for (int i = 0; i < 3; i++) {
            pipeline.instrument(InboundRequest.of("GET", "/health"), () -> 200, status -> status);
        }

        Map<String, String> labels = Map.of("method", "GET", "path", "/health", "status", "200");
        assertThat(metricsStorage.total(COUNTER, labels)).isEqualTo(3.0);
        assertThat(metricsStorage.samples(HISTOGRAM)).hasSize(3);
        assertThat(logStorage.entries()).hasSize(3);
    }

    @Test
    void identifiersCollapseIntoOneSeries() throws Exception {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.defaults());

        for (int id = 1; id <= 3; id++) {
            pipeline.instrument(InboundRequest.of("GET", "/users/" + id), () -> 200, status -> status);
        }

        assertThat(metricsStorage.samples(COUNTER))
                .extracting(sample -> sample.labels().get("path"))
                .containsOnly("/users/{id}");
        assertThat(metricsStorage.total(COUNTER,
                Map.of("method", "GET", "path", "/users/{id}", "status", "200"))).isEqualTo(3.0);
    }

    @Test
    void frameworkRouteTemplateIsPreferred() throws Exception {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.defaults());
        InboundRequest request = InboundRequest.of("GET", "/files/report.pdf")
                .withRouteTemplate(() -> "/files/{name}");

        pipeline.instrument(request, () -> 200, status -> status);

        assertThat(metricsStorage.samples(COUNTER).get(0).labels()).containsEntry("path", "/files/{name}");
        assertThat(logStorage.entries().get(0).attribute("route")).isEqualTo("/files/{name}");
        assertThat(logStorage.entries().get(0).attribute("path")).isEqualTo("/files/report.pdf");
    }

    @Test
    void excludedPathHasNoSideEffects() throws Exception {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.builder().excludePath("/health").build());

        String response = pipeline.instrument(InboundRequest.of("GET", "/health"), () -> {
            assertThat(RequestContextHolder.current()).isEmpty();
            return "ok";
        }, ignored -> 200);

        assertThat(response).isEqualTo("ok");
        assertThat(logStorage.entries()).isEmpty();
        assertThat(metricsStorage.samples()).isEmpty();
    }

    @Test
    void handlerExceptionIsLoggedAsErrorAndRethrownUnchanged() {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.defaults());
        IllegalStateException boom = new IllegalStateException("kaput");

        assertThatThrownBy(() -> pipeline.instrument(InboundRequest.of("POST", "/orders"), () -> {
            throw boom;
        }, ignored -> 200)).isSameAs(boom);

        assertThat(logStorage.entries()).hasSize(1);
        LogEntry entry = logStorage.entries().get(0);
        assertThat(entry.level()).isEqualTo(LogLevel.ERROR);
        assertThat(entry.attribute("status_code")).isEqualTo(500);
        assertThat(entry.attribute("exception")).asString().contains("kaput");
        assertThat(entry.attribute("exception_type")).isEqualTo(IllegalStateException.class.getName());
        assertThat(metricsStorage.samples(COUNTER).get(0).labels()).containsEntry("status", "500");
        assertThat(RequestContextHolder.current()).isEmpty();
    }

    @Test
    void failingContextTeardownDoesNotMaskHandlerException() {
        InstrumentationPipeline pipeline = new InstrumentationPipeline(MiddlewareConfig.defaults(),
                logStorage, metricsStorage, new TimedWriter(telemetryExecutor), diagnostics,
                Clock.systemUTC(), context -> {
                    RequestContextHolder.end(context);
                    throw new IllegalStateException("teardown");
                });
        IllegalArgumentException boom = new IllegalArgumentException("handler failed");

        assertThatThrownBy(() -> pipeline.instrument(InboundRequest.of("GET", "/x"), () -> {
            throw boom;
        }, ignored -> 200)).isSameAs(boom);

        assertThat(registry.get("observability.cleanup.failures").counter().count()).isEqualTo(1.0);
        assertThat(logStorage.entries()).singleElement()
                .satisfies(entry -> assertThat(entry.attribute("exception")).asString().contains("handler failed"));
    }

    @Test
    void failingContextTeardownKeepsSuccessfulResponse() throws Exception {
        InstrumentationPipeline pipeline = new InstrumentationPipeline(MiddlewareConfig.defaults(),
                logStorage, metricsStorage, new TimedWriter(telemetryExecutor), diagnostics,
                Clock.systemUTC(), context -> {
                    RequestContextHolder.end(context);
                    throw new IllegalStateException("teardown");
                });

        String response = pipeline.instrument(InboundRequest.of("GET", "/x"), () -> "ok", ignored -> 200);

        assertThat(response).isEqualTo("ok");
        assertThat(registry.get("observability.cleanup.failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    void checkedHandlerExceptionIsRethrownUnchanged() {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.defaults());
        Exception checked = new Exception("checked");

        assertThatThrownBy(() -> pipeline.instrument(InboundRequest.of("GET", "/x"), () -> {
            throw checked;
        }, ignored -> 200)).isSameAs(checked);
    }

    @Test
    void statusCodeSelectsLogLevel() throws Exception {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.defaults());

        pipeline.instrument(InboundRequest.of("GET", "/a"), () -> 200, status -> status);
        pipeline.instrument(InboundRequest.of("GET", "/b"), () -> 404, status -> status);
        pipeline.instrument(InboundRequest.of("GET", "/c"), () -> 503, status -> status);

        assertThat(logStorage.entries())
                .extracting(LogEntry::level)
                .containsExactly(LogLevel.INFO, LogLevel.WARN, LogLevel.ERROR);
    }

    @Test
    void logEntryCarriesRequestFieldsAndContextAttributes() throws Exception {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.defaults());
        InboundRequest request = InboundRequest.of("GET", "/ping", Map.of("x-request-id", "abc123"));

        pipeline.instrument(request, () -> {
            LogContext.update("user_id", "demo");
            return 200;
        }, status -> status);

        LogEntry entry = logStorage.entries().get(0);
        assertThat(entry.level()).isEqualTo(LogLevel.INFO);
        assertThat(entry.message()).isEqualTo("GET /ping 200");
        assertThat(entry.attributes())
                .containsEntry("request_id", "abc123")
                .containsEntry("method", "GET")
                .containsEntry("path", "/ping")
                .containsEntry("status_code", 200)
                .containsEntry("user_id", "demo")
                .containsKey("duration_ms");
    }

    @Test
    void histogramHasTwelveBucketsAndPositiveDuration() throws Exception {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.defaults());

        pipeline.instrument(InboundRequest.of("GET", "/slow"), () -> {
            Thread.sleep(5);
            return 200;
        }, status -> status);

        MetricSample histogram = metricsStorage.samples(HISTOGRAM).get(0);
        assertThat(histogram.buckets()).hasSize(12);
        assertThat(histogram.value()).isGreaterThan(0.0);
    }

    @Test
    void neverCompletingLogWriteIsBoundedByTimeout() throws Exception {
        LogStoragePort hanging = mock(LogStoragePort.class);
        when(hanging.write(any())).thenReturn(new CompletableFuture<>());
        Duration timeout = Duration.ofMillis(100);
        InstrumentationPipeline pipeline = new InstrumentationPipeline(
                MiddlewareConfig.builder().writeTimeout(timeout).build(),
                hanging, metricsStorage, new TimedWriter(telemetryExecutor), diagnostics);

        long start = System.nanoTime();
        Integer response = pipeline.instrument(InboundRequest.of("GET", "/x"), () -> 200, status -> status);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(response).isEqualTo(200);
        assertThat(elapsedMillis).isLessThan(timeout.toMillis() + 400);
        assertThat(registry.get("observability.write.failures")
                .tag("outcome", "timed_out").tag("kind", "log").counter().count()).isEqualTo(1.0);
        assertThat(metricsStorage.samples(COUNTER)).hasSize(1);
    }

    @Test
    void failingLogStorageDoesNotAffectResponseOrMetrics() throws Exception {
        LogStoragePort failing = mock(LogStoragePort.class);
        when(failing.write(any())).thenThrow(new IllegalStateException("storage down"));
        InstrumentationPipeline pipeline = new InstrumentationPipeline(MiddlewareConfig.defaults(),
                failing, metricsStorage, new TimedWriter(telemetryExecutor), diagnostics);

        String response = pipeline.instrument(InboundRequest.of("GET", "/x"), () -> "ok", ignored -> 200);

        assertThat(response).isEqualTo("ok");
        assertThat(metricsStorage.samples(COUNTER)).hasSize(1);
        assertThat(registry.get("observability.write.failures")
                .tag("outcome", "failed").tag("kind", "log").counter().count()).isEqualTo(1.0);
    }

    @Test
    void logRequestsToggle() throws Exception {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.builder().logRequests(false).build());

        pipeline.instrument(InboundRequest.of("GET", "/x"), () -> 200, status -> status);

        assertThat(logStorage.entries()).isEmpty();
        assertThat(metricsStorage.samples()).hasSize(2);
    }

    @Test
    void recordMetricsToggle() throws Exception {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.builder().recordMetrics(false).build());

        pipeline.instrument(InboundRequest.of("GET", "/x"), () -> 200, status -> status);

        assertThat(logStorage.entries()).hasSize(1);
        assertThat(metricsStorage.samples()).isEmpty();
    }

    @Test
    void customMetricNames() throws Exception {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.builder()
                .requestCounterName("api_calls")
                .requestHistogramName("api_latency")
                .build());

        pipeline.instrument(InboundRequest.of("GET", "/x"), () -> 200, status -> status);

        assertThat(metricsStorage.samples())
                .extracting(MetricSample::name)
                .containsExactlyInAnyOrder("api_calls", "api_latency");
    }

    @Test
    void customRequestIdHeader() throws Exception {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.builder().requestIdHeader("X-Correlation-ID").build());
        InboundRequest request = InboundRequest.of("GET", "/x",
                Map.of("X-Correlation-ID", "corr-1", "X-Request-ID", "ignored"));

        String seen = pipeline.instrument(request, () -> RequestContextHolder.currentId().orElse(null), ignored -> 200);

        assertThat(seen).isEqualTo("corr-1");
        assertThat(logStorage.entries().get(0).attribute("request_id")).isEqualTo("corr-1");
    }

    @Test
    void contextIsReleasedAfterRequest() throws Exception {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.defaults());

        pipeline.instrument(InboundRequest.of("GET", "/x"), () -> {
            LogContext.update("k", "v");
            return 200;
        }, status -> status);

        assertThat(RequestContextHolder.current()).isEmpty();
        assertThat(LogContext.get()).isEmpty();
    }

    @Test
    void concurrentRequestsKeepTheirOwnContext() throws Exception {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.defaults());
        ExecutorService requests = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String id = "req-" + i;
                results.add(requests.submit(() -> {
                    start.await();
                    InboundRequest request = InboundRequest.of("GET", "/items/" + suffix(id),
                            Map.of("X-Request-ID", id));
                    return pipeline.instrument(request, () -> {
                        LogContext.update("owner", id);
                        Thread.sleep(1);
                        return id + "=" + LogContext.get().get("owner");
                    }, ignored -> 200);
                }));
            }
            start.countDown();
            for (int i = 0; i < results.size(); i++) {
                assertThat(results.get(i).get(10, TimeUnit.SECONDS)).isEqualTo("req-" + i + "=req-" + i);
            }
        } finally {
            requests.shutdownNow();
        }

        assertThat(logStorage.entries()).hasSize(40)
                .allSatisfy(entry -> assertThat(entry.attribute("owner")).isEqualTo(entry.attribute("request_id")));
    }

    @Test
    void excludedPathsUsePrefixPatterns() throws Exception {
        InstrumentationPipeline pipeline = pipeline(MiddlewareConfig.builder().excludePath("/actuator/*").build());

        pipeline.instrument(InboundRequest.of("GET", "/actuator/prometheus"), () -> 200, status -> status);
        pipeline.instrument(InboundRequest.of("GET", "/users/1"), () -> 200, status -> status);

        assertThat(logStorage.entries()).hasSize(1);
        assertThat(logStorage.read(Instant.EPOCH, null)).hasSize(1);
    }

    private InstrumentationPipeline pipeline(MiddlewareConfig config) {
        return new InstrumentationPipeline(config, logStorage, metricsStorage,
                new TimedWriter(telemetryExecutor), diagnostics);
    }

    private static String suffix(String id) {
        return id.substring(id.indexOf('-') + 1);
    }
}
