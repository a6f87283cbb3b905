package com.phillippitts.observability.service.storage;

import com.phillippitts.observability.domain.LogEntry;
import com.phillippitts.observability.domain.LogLevel;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Unbounded in-memory log storage. Suitable for tests and low-volume services.
 */
public class InMemoryLogStorage implements LogStoragePort {

    private final ConcurrentLinkedQueue<LogEntry> entries = new ConcurrentLinkedQueue<>();

    @Override
    public CompletableFuture<Void> write(LogEntry entry) {
        entries.add(Objects.requireNonNull(entry, "entry"));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public List<LogEntry> read(Instant since, LogLevel level) {
        return entries.stream()
                .filter(e -> since == null || e.timestamp().isAfter(since))
                .filter(e -> level == null || e.level() == level)
                .sorted(Comparator.comparing(LogEntry::timestamp))
                .toList();
    }

    /**
     * Returns all stored entries in write order.
     */
    public List<LogEntry> entries() {
        return List.copyOf(entries);
    }
}
