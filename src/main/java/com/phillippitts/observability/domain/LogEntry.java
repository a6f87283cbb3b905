package com.phillippitts.observability.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable structured log record handed to a log storage port.
 *
 * @param timestamp when the entry was produced
 * @param level severity
 * @param message human-readable summary
 * @param attributes structured fields in insertion order
 */
public record LogEntry(Instant timestamp, LogLevel level, String message, Map<String, Object> attributes) {

    public LogEntry {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(level, "level");
        message = message == null ? "" : message;
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Returns a single attribute value.
     *
     * @param key attribute name
     * @return value, or {@code null} when absent
     */
    public Object attribute(String key) {
        return attributes.get(key);
    }
}
