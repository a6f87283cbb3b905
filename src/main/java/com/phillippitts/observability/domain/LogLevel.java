package com.phillippitts.observability.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity of a stored {@link LogEntry}.
 *
 * <p>Request log entries only use {@link #INFO}, {@link #WARN} and {@link #ERROR}; {@link #DEBUG}
 * appears when application log events are bridged into storage.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    /**
     * Maps an HTTP status code to the level of its request log entry.
     *
     * <p>The cutoffs are fixed: below 400 is INFO, 400-499 is WARN, 500 and above is ERROR.
     *
     * @param statusCode response status code
     * @return level for the request log entry
     */
    public static LogLevel forStatus(int statusCode) {
        if (statusCode >= 500) {
            return ERROR;
        }
        if (statusCode >= 400) {
            return WARN;
        }
        return INFO;
    }

    /**
     * Parses a level name case-insensitively; {@code WARNING} is accepted as an alias for WARN.
     *
     * @param value level name, may be {@code null}
     * @return parsed level, or empty when the value is blank or unknown
     */
    public static Optional<LogLevel> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            return Optional.of(WARN);
        }
        for (LogLevel level : values()) {
            if (level.name().equals(normalized)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
