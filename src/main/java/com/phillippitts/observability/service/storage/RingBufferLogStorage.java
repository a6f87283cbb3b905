package com.phillippitts.observability.service.storage;

import com.phillippitts.observability.domain.LogEntry;
import com.phillippitts.observability.domain.LogLevel;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Fixed-capacity log storage that evicts the oldest entry once full.
 * Gives production services a predictable memory footprint.
 */
public class RingBufferLogStorage implements LogStoragePort {

    private final int capacity;
    private final ArrayDeque<LogEntry> buffer;

    public RingBufferLogStorage(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    @Override
    public CompletableFuture<Void> write(LogEntry entry) {
        Objects.requireNonNull(entry, "entry");
        synchronized (buffer) {
            if (buffer.size() == capacity) {
                buffer.pollFirst();
            }
            buffer.addLast(entry);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public List<LogEntry> read(Instant since, LogLevel level) {
        List<LogEntry> snapshot;
        synchronized (buffer) {
            snapshot = new ArrayList<>(buffer);
        }
        return snapshot.stream()
                .filter(e -> since == null || e.timestamp().isAfter(since))
                .filter(e -> level == null || e.level() == level)
                .sorted(Comparator.comparing(LogEntry::timestamp))
                .toList();
    }

    public int size() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    public int getCapacity() {
        return capacity;
    }
}
