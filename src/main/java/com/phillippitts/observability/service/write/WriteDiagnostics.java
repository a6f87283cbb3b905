package com.phillippitts.observability.service.write;

import com.phillippitts.observability.exception.ContextCleanupException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Objects;

/**
 * Fallback error channel for failures of the observability layer itself.
 *
 * <p>Reports go to the dedicated {@value #LOGGER_NAME} Log4j2 logger, which is kept apart from the
 * request log stream, and increment {@code observability.write.failures}. Nothing here throws.
 *
 * <p>Metrics:
 * <ul>
 *   <li>{@code observability.write.failures{outcome, kind}} - timed out or failed storage writes</li>
 *   <li>{@code observability.cleanup.failures} - request context teardown failures</li>
 * </ul>
 */
public class WriteDiagnostics {

    /** Name of the diagnostics logger. */
    public static final String LOGGER_NAME = "observability.diagnostics";

    private static final Logger DIAGNOSTICS = LogManager.getLogger(LOGGER_NAME);

    private final MeterRegistry registry;

    public WriteDiagnostics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Reports a storage write that did not complete.
     *
     * @param kind what was written (log, counter, histogram)
     * @param outcome outcome of the bounded write; completed outcomes are ignored
     * @param requestId correlation id of the request the write belonged to
     */
    public void report(String kind, WriteOutcome outcome, String requestId) {
        if (outcome == null || outcome.isCompleted()) {
            return;
        }
        if (outcome.status() == WriteOutcome.Status.TIMED_OUT) {
            DIAGNOSTICS.warn("{} write timed out after {} ms (requestId={})",
                    kind, outcome.timeout() == null ? -1 : outcome.timeout().toMillis(), requestId);
        } else {
            DIAGNOSTICS.warn("{} write failed (requestId={}): {}",
                    kind, requestId, describe(outcome.error()), outcome.error());
        }
        Counter.builder("observability.write.failures")
                .description("Storage writes that timed out or failed")
                .tag("outcome", outcome.status().name().toLowerCase(Locale.ROOT))
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * Reports an error raised while building or dispatching request telemetry.
     */
    public void reportEmissionFailure(String requestId, Throwable error) {
        DIAGNOSTICS.error("Request telemetry emission failed (requestId={})", requestId, error);
    }

    /**
     * Reports a failure while releasing a request context. Never masks a handler exception;
     * the caller keeps propagating whatever it was propagating.
     */
    public void reportCleanupFailure(String requestId, Throwable error) {
        ContextCleanupException wrapped = new ContextCleanupException(requestId, error);
        DIAGNOSTICS.error(wrapped.getMessage(), wrapped);
        Counter.builder("observability.cleanup.failures")
                .description("Request context teardown failures")
                .register(registry)
                .increment();
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
