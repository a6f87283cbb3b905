package com.phillippitts.observability.service.pipeline;

import com.phillippitts.observability.service.context.RequestContext;
import com.phillippitts.observability.service.context.RequestContextHolder;
import com.phillippitts.observability.service.metrics.MetricRecorder;
import com.phillippitts.observability.service.path.RequestPathMatcher;
import com.phillippitts.observability.service.storage.LogStoragePort;
import com.phillippitts.observability.service.storage.MetricsStoragePort;
import com.phillippitts.observability.service.write.TimedWriter;
import com.phillippitts.observability.service.write.WriteDiagnostics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.ToIntFunction;

/**
 * Instruments inbound requests: correlation id, timing, one log entry, request counter and
 * duration histogram, with guaranteed context cleanup.
 *
 * <p><b>Per-request lifecycle:</b>
 * <ol>
 *   <li>START - excluded paths go straight to the handler with no side effects; otherwise a
 *       {@link RequestContext} is begun, seeded from the correlation header</li>
 *   <li>RUNNING - the handler runs with the context bound</li>
 *   <li>SUCCESS / HANDLER_EXCEPTION - status classified; a handler exception counts as 500</li>
 *   <li>FINALIZING - log entry and metrics written through the {@link TimedWriter}</li>
 *   <li>DONE - the context is ended unconditionally</li>
 * </ol>
 *
 * <p>Two entry points with identical observable behavior are provided:
 * {@link #instrument} for thread-per-request transports and {@link #instrumentAsync} for
 * handlers that complete a {@link CompletionStage} later, possibly on another thread.
 *
 * <p><b>Error Handling:</b> the handler's result or exception is returned/rethrown unchanged.
 * Storage failures and cleanup failures are reported via {@link WriteDiagnostics} and never
 * propagate.
 *
 * <p><b>Thread Safety:</b> immutable after construction; safe for concurrent requests.
 */
public class InstrumentationPipeline {

    private static final Logger LOG = LogManager.getLogger(InstrumentationPipeline.class);

    /** Status recorded when the handler throws. */
    static final int STATUS_ON_EXCEPTION = 500;

    private static final String NO_STAGE = "downstream returned no completion stage";

    private final MiddlewareConfig config;
    private final RequestTelemetryEmitter emitter;
    private final WriteDiagnostics diagnostics;
    private final Consumer<RequestContext> contextTeardown;

    public InstrumentationPipeline(MiddlewareConfig config,
                                   LogStoragePort logStorage,
                                   MetricsStoragePort metricsStorage,
                                   TimedWriter writer,
                                   WriteDiagnostics diagnostics) {
        this(config, logStorage, metricsStorage, writer, diagnostics, Clock.systemUTC());
    }

    public InstrumentationPipeline(MiddlewareConfig config,
                                   LogStoragePort logStorage,
                                   MetricsStoragePort metricsStorage,
                                   TimedWriter writer,
                                   WriteDiagnostics diagnostics,
                                   Clock clock) {
        this(config, logStorage, metricsStorage, writer, diagnostics, clock, RequestContextHolder::end);
    }

    InstrumentationPipeline(MiddlewareConfig config,
                            LogStoragePort logStorage,
                            MetricsStoragePort metricsStorage,
                            TimedWriter writer,
                            WriteDiagnostics diagnostics,
                            Clock clock,
                            Consumer<RequestContext> contextTeardown) {
        this.config = Objects.requireNonNull(config, "config");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.contextTeardown = Objects.requireNonNull(contextTeardown, "contextTeardown");
        this.emitter = new RequestTelemetryEmitter(
                config,
                logStorage,
                new MetricRecorder(metricsStorage, clock),
                writer,
                diagnostics,
                new RequestPathMatcher(config.routeTemplates()),
                clock);
    }

    public MiddlewareConfig getConfig() {
        return config;
    }

    /**
     * Checks whether a request bypasses instrumentation.
     */
    public boolean isExcluded(InboundRequest request) {
        return RequestPathMatcher.isExcluded(request.path(), config.excludePaths());
    }

    /**
     * Runs a blocking handler under instrumentation.
     *
     * <p>Emissions are awaited before returning, each bounded by the configured write timeout.
     *
     * @param request inbound request
     * @param downstream the handler
     * @param statusOf extracts the status code from the handler's response
     * @param <R> response type
     * @return exactly what the handler returned
     * @throws Exception exactly what the handler threw
     */
    public <R> R instrument(InboundRequest request,
                            Downstream<R> downstream,
                            ToIntFunction<? super R> statusOf) throws Exception {
        return instrument(request, downstream, statusOf, ignored -> null);
    }

    /**
     * Runs a blocking handler under instrumentation, recording an exception the handler already
     * turned into a response.
     *
     * <p>Transports whose framework maps handler exceptions to error responses before they reach
     * the pipeline use {@code handledErrorOf} to hand the mapped exception over, so the request
     * log entry still carries it. The response is returned as usual.
     *
     * @param handledErrorOf extracts the exception behind an error response, or {@code null}
     * @see #instrument(InboundRequest, Downstream, ToIntFunction)
     */
    public <R> R instrument(InboundRequest request,
                            Downstream<R> downstream,
                            ToIntFunction<? super R> statusOf,
                            Function<? super R, ? extends Throwable> handledErrorOf) throws Exception {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(downstream, "downstream");
        Objects.requireNonNull(statusOf, "statusOf");
        Objects.requireNonNull(handledErrorOf, "handledErrorOf");

        if (isExcluded(request)) {
            LOG.debug("Skipping instrumentation for excluded path {}", request.path());
            return downstream.call();
        }

        RequestContext context = RequestContextHolder.begin(seedId(request));
        long startNanos = System.nanoTime();
        try {
            R response = downstream.call();
            int status = statusOf.applyAsInt(response);
            Throwable handledError = handledErrorOf.apply(response);
            finalizeBlocking(new RequestOutcome(request, context, status,
                    System.nanoTime() - startNanos, handledError));
            return response;
        } catch (Throwable handlerError) {
            finalizeBlocking(new RequestOutcome(request, context, STATUS_ON_EXCEPTION,
                    System.nanoTime() - startNanos, handlerError));
            throw handlerError;
        } finally {
            release(context);
        }
    }

    /**
     * Runs a handler that completes asynchronously under instrumentation.
     *
     * <p>The context is bound while {@code downstream} builds its stage and is detached from the
     * calling thread as soon as it returns; continuations that need it must be wrapped with
     * {@link RequestContextHolder#wrap(Runnable)} or run on an executor decorated with
     * {@link com.phillippitts.observability.service.context.RequestContextTaskDecorator}.
     * The returned future completes after finalization with the handler's value or exception.
     * An exception thrown synchronously by {@code downstream} is rethrown synchronously.
     *
     * @param request inbound request
     * @param downstream starts the handler and returns its completion stage
     * @param statusOf extracts the status code from the handler's response
     * @param <R> response type
     * @return future mirroring the handler's stage
     */
    public <R> CompletableFuture<R> instrumentAsync(InboundRequest request,
                                                    Supplier<? extends CompletionStage<R>> downstream,
                                                    ToIntFunction<? super R> statusOf) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(downstream, "downstream");
        Objects.requireNonNull(statusOf, "statusOf");

        if (isExcluded(request)) {
            LOG.debug("Skipping instrumentation for excluded path {}", request.path());
            return Objects.requireNonNull(downstream.get(), NO_STAGE).toCompletableFuture();
        }

        RequestContext context = RequestContextHolder.begin(seedId(request));
        long startNanos = System.nanoTime();
        CompletionStage<R> stage;
        try {
            stage = Objects.requireNonNull(downstream.get(), NO_STAGE);
        } catch (RuntimeException | Error handlerError) {
            finalizeBlocking(new RequestOutcome(request, context, STATUS_ON_EXCEPTION,
                    System.nanoTime() - startNanos, handlerError));
            release(context);
            throw handlerError;
        }
        RequestContextHolder.detach(context);

        CompletableFuture<R> result = new CompletableFuture<>();
        stage.whenComplete((response, error) -> {
            long durationNanos = System.nanoTime() - startNanos;
            Throwable handlerError = unwrap(error);
            int status = STATUS_ON_EXCEPTION;
            if (handlerError == null) {
                try {
                    status = statusOf.applyAsInt(response);
                } catch (RuntimeException statusError) {
                    handlerError = statusError;
                }
            }
            Throwable failure = handlerError;
            emitSafely(new RequestOutcome(request, context, status, durationNanos, failure))
                    .whenComplete((ignored, emitError) -> {
                        release(context);
                        if (failure == null) {
                            result.complete(response);
                        } else {
                            result.completeExceptionally(failure);
                        }
                    });
        });
        return result;
    }

    private String seedId(InboundRequest request) {
        return request.header(config.requestIdHeader()).orElse(null);
    }

    private void finalizeBlocking(RequestOutcome outcome) {
        emitSafely(outcome).join();
    }

    private CompletableFuture<Void> emitSafely(RequestOutcome outcome) {
        String requestId = outcome.context().id();
        try {
            return emitter.emit(outcome).exceptionally(error -> {
                diagnostics.reportEmissionFailure(requestId, unwrap(error));
                return null;
            });
        } catch (RuntimeException error) {
            diagnostics.reportEmissionFailure(requestId, error);
            return CompletableFuture.completedFuture(null);
        }
    }

    private void release(RequestContext context) {
        try {
            contextTeardown.accept(context);
        } catch (RuntimeException cleanupError) {
            diagnostics.reportCleanupFailure(context.id(), cleanupError);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
