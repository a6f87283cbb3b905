package com.phillippitts.observability.service.storage;

import com.phillippitts.observability.domain.LogEntry;
import com.phillippitts.observability.domain.LogLevel;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Storage port for structured log entries.
 *
 * <p>Implementations must tolerate concurrent calls from many requests. A write may complete
 * asynchronously; failures are signalled by completing the returned future exceptionally
 * or by throwing {@link com.phillippitts.observability.exception.StorageWriteException}.
 */
public interface LogStoragePort {

    /**
     * Stores a log entry.
     *
     * @param entry entry to store
     * @return future completed once the entry is stored
     */
    CompletableFuture<Void> write(LogEntry entry);

    /**
     * Reads stored entries newer than {@code since}, ordered by timestamp ascending.
     *
     * @param since exclusive lower bound; {@code null} returns all entries
     * @param level only entries of this level; {@code null} returns all levels
     * @return matching entries
     */
    List<LogEntry> read(Instant since, LogLevel level);
}
