package com.phillippitts.observability.config.logging;

import com.phillippitts.observability.domain.LogEntry;
import com.phillippitts.observability.domain.LogLevel;
import com.phillippitts.observability.service.context.LogContext;
import com.phillippitts.observability.service.storage.LogStoragePort;
import com.phillippitts.observability.service.write.TimedWriter;
import com.phillippitts.observability.service.write.WriteDiagnostics;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Log4j2 appender that copies application log events into the {@link LogStoragePort}.
 *
 * <p>Events are converted on the logging thread, so the current request's {@link LogContext}
 * ({@code request_id} and custom attributes) is attached to every entry written while a request
 * is active. The storage write itself is started through the {@link TimedWriter} and not awaited.
 *
 * <p>Events below {@code INFO} and events of the diagnostics logger are ignored.
 */
public class LogStorageAppender extends AbstractAppender {

    public static final String NAME = "LogStorage";

    // Appenders are keyed by name; each application context attaches its own instance
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final LogStoragePort storage;
    private final TimedWriter writer;
    private final Duration writeTimeout;
    private final WriteDiagnostics diagnostics;

    public LogStorageAppender(LogStoragePort storage, TimedWriter writer, Duration writeTimeout,
                              WriteDiagnostics diagnostics) {
        super(NAME + "-" + SEQUENCE.incrementAndGet(), null, null, true, Property.EMPTY_ARRAY);
        this.storage = Objects.requireNonNull(storage, "storage");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.writeTimeout = Objects.requireNonNull(writeTimeout, "writeTimeout");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Starts the appender and adds it to the root logger.
     */
    public void attach() {
        start();
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        ctx.getRootLogger().addAppender(this);
    }

    /**
     * Removes the appender from the root logger and stops it.
     */
    public void detach() {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        ctx.getRootLogger().removeAppender(this);
        stop();
    }

    @Override
    public void append(LogEvent event) {
        if (!accepts(event)) {
            return;
        }
        LogEntry entry = toEntry(event);
        Object requestId = entry.attribute(LogContext.REQUEST_ID);
        writer.writeBounded(() -> storage.write(entry), writeTimeout)
                .thenAccept(outcome -> diagnostics.report("app_log", outcome,
                        requestId == null ? null : requestId.toString()));
    }

    static boolean accepts(LogEvent event) {
        return event.getLevel().isMoreSpecificThan(Level.INFO)
                && !WriteDiagnostics.LOGGER_NAME.equals(event.getLoggerName());
    }

    static LogEntry toEntry(LogEvent event) {
        Map<String, Object> attributes = new LinkedHashMap<>(LogContext.get());
        attributes.put("logger", event.getLoggerName());
        attributes.put("thread", event.getThreadName());
        Throwable thrown = event.getThrown();
        if (thrown != null) {
            attributes.put("exception", thrown.getClass().getName() + ": " + thrown.getMessage());
            attributes.put("exception_type", thrown.getClass().getName());
        }
        Instant timestamp = Instant.ofEpochMilli(event.getTimeMillis());
        return new LogEntry(timestamp, toLevel(event.getLevel()), event.getMessage().getFormattedMessage(),
                attributes);
    }

    static LogLevel toLevel(Level level) {
        if (level.isMoreSpecificThan(Level.ERROR)) {
            return LogLevel.ERROR;
        }
        if (level.isMoreSpecificThan(Level.WARN)) {
            return LogLevel.WARN;
        }
        if (level.isMoreSpecificThan(Level.INFO)) {
            return LogLevel.INFO;
        }
        return LogLevel.DEBUG;
    }
}
