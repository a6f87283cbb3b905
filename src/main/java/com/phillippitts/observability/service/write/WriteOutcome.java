package com.phillippitts.observability.service.write;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of a bounded storage write.
 *
 * @param status how the write ended
 * @param error failure cause for {@link Status#FAILED}; {@code null} otherwise
 * @param timeout deadline the write was raced against
 */
public record WriteOutcome(Status status, Throwable error, Duration timeout) {

    /** How a bounded write ended. */
    public enum Status { COMPLETED, TIMED_OUT, FAILED }

    public WriteOutcome {
        Objects.requireNonNull(status, "status");
    }

    public static WriteOutcome completed(Duration timeout) {
        return new WriteOutcome(Status.COMPLETED, null, timeout);
    }

    public static WriteOutcome timedOut(Duration timeout) {
        return new WriteOutcome(Status.TIMED_OUT, null, timeout);
    }

    public static WriteOutcome failed(Throwable error, Duration timeout) {
        return new WriteOutcome(Status.FAILED, Objects.requireNonNull(error, "error"), timeout);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
