package com.phillippitts.observability.service.write;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs best-effort storage writes against a deadline.
 *
 * <p>Each write is started on a dedicated executor and raced against its timeout. The returned
 * future always completes normally, no later than the timeout, with one of:
 * <ul>
 *   <li>{@link WriteOutcome.Status#COMPLETED} - the write finished in time</li>
 *   <li>{@link WriteOutcome.Status#TIMED_OUT} - the deadline passed; the write is abandoned</li>
 *   <li>{@link WriteOutcome.Status#FAILED} - the write threw, completed exceptionally, or could
 *       not be scheduled</li>
 * </ul>
 *
 * <p>Writes are never retried. Reporting non-completed outcomes is the caller's job
 * (see {@link WriteDiagnostics}).
 *
 * <p><b>Thread Model:</b> the executor must reject work when saturated rather than run it on the
 * caller; a rejected write is reported as {@code FAILED} so that request threads never execute
 * storage writes themselves.
 */
public class TimedWriter {

    private final Executor executor;

    /**
     * @param executor bounded executor dedicated to storage writes
     */
    public TimedWriter(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Starts a write and races it against {@code timeout}.
     *
     * @param writeFn starts the storage write; may block, throw, or return a pending stage
     * @param timeout maximum time allotted to the write; must be positive
     * @return future that always completes normally within {@code timeout}
     */
    public CompletableFuture<WriteOutcome> writeBounded(Supplier<? extends CompletionStage<?>> writeFn,
                                                        Duration timeout) {
        Objects.requireNonNull(writeFn, "writeFn");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }

        Supplier<CompletionStage<?>> task = writeFn::get;
        CompletableFuture<Void> pending;
        try {
            pending = CompletableFuture.supplyAsync(task, executor).thenCompose(TimedWriter::settle);
        } catch (RejectedExecutionException rejected) {
            return CompletableFuture.completedFuture(WriteOutcome.failed(rejected, timeout));
        }

        CompletableFuture<WriteOutcome> outcome = pending
                .handle((ignored, error) -> error == null
                        ? WriteOutcome.completed(timeout)
                        : WriteOutcome.failed(unwrap(error), timeout))
                .completeOnTimeout(WriteOutcome.timedOut(timeout), timeout.toNanos(), TimeUnit.NANOSECONDS);

        outcome.thenAccept(result -> {
            if (result.status() == WriteOutcome.Status.TIMED_OUT) {
                pending.cancel(true);
            }
        });
        return outcome;
    }

    /**
     * Waits for a bounded write started by {@link #writeBounded(Supplier, Duration)}.
     *
     * @param outcome future returned by {@code writeBounded}
     * @return the outcome; never throws for storage failures
     */
    public static WriteOutcome await(CompletableFuture<WriteOutcome> outcome) {
        return outcome.join();
    }

    private static CompletionStage<Void> settle(CompletionStage<?> stage) {
        if (stage == null) {
            return CompletableFuture.completedFuture(null);
        }
        return stage.thenApply(ignored -> null);
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
