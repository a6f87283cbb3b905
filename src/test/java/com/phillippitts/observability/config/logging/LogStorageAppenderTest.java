package com.phillippitts.observability.config.logging;

import com.phillippitts.observability.domain.LogEntry;
import com.phillippitts.observability.domain.LogLevel;
import com.phillippitts.observability.service.context.LogContext;
import com.phillippitts.observability.service.context.RequestContext;
import com.phillippitts.observability.service.context.RequestContextHolder;
import com.phillippitts.observability.service.storage.InMemoryLogStorage;
import com.phillippitts.observability.service.write.TimedWriter;
import com.phillippitts.observability.service.write.WriteDiagnostics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.impl.Log4jLogEvent;
import org.apache.logging.log4j.message.SimpleMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class LogStorageAppenderTest {

    private ExecutorService executor;
    private InMemoryLogStorage storage;
    private LogStorageAppender appender;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        storage = new InMemoryLogStorage();
        appender = new LogStorageAppender(storage, new TimedWriter(executor), Duration.ofSeconds(1),
                new WriteDiagnostics(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        RequestContextHolder.current().ifPresent(RequestContextHolder::end);
        executor.shutdownNow();
    }

    @Test
    void storesEventWithRequestContext() {
        RequestContext context = RequestContextHolder.begin("req-app");
        LogContext.update("user_id", "demo");

        appender.append(event("com.example.Service", Level.INFO, "Loading user", null));
        RequestContextHolder.end(context);

        await().atMost(3, SECONDS).until(() -> storage.entries().size() == 1);
        LogEntry entry = storage.entries().get(0);
        assertThat(entry.level()).isEqualTo(LogLevel.INFO);
        assertThat(entry.message()).isEqualTo("Loading user");
        assertThat(entry.attributes())
                .containsEntry("request_id", "req-app")
                .containsEntry("user_id", "demo")
                .containsEntry("logger", "com.example.Service");
    }

    @Test
    void storesExceptionFields() {
        appender.append(event("com.example.Service", Level.ERROR, "Failed", new IllegalStateException("bad")));

        await().atMost(3, SECONDS).until(() -> storage.entries().size() == 1);
        LogEntry entry = storage.entries().get(0);
        assertThat(entry.level()).isEqualTo(LogLevel.ERROR);
        assertThat(entry.attribute("exception_type")).isEqualTo(IllegalStateException.class.getName());
        assertThat(entry.attributes()).doesNotContainKey("request_id");
    }

    @Test
    void ignoresDebugAndDiagnosticsEvents() {
        assertThat(LogStorageAppender.accepts(event("com.example.Service", Level.DEBUG, "noise", null))).isFalse();
        assertThat(LogStorageAppender.accepts(event(WriteDiagnostics.LOGGER_NAME, Level.WARN, "timeout", null)))
                .isFalse();
        assertThat(LogStorageAppender.accepts(event("com.example.Service", Level.WARN, "slow", null))).isTrue();
    }

    @Test
    void mapsLog4jLevels() {
        assertThat(LogStorageAppender.toLevel(Level.FATAL)).isEqualTo(LogLevel.ERROR);
        assertThat(LogStorageAppender.toLevel(Level.ERROR)).isEqualTo(LogLevel.ERROR);
        assertThat(LogStorageAppender.toLevel(Level.WARN)).isEqualTo(LogLevel.WARN);
        assertThat(LogStorageAppender.toLevel(Level.INFO)).isEqualTo(LogLevel.INFO);
        assertThat(LogStorageAppender.toLevel(Level.TRACE)).isEqualTo(LogLevel.DEBUG);
    }

    @Test
    void attachedAppenderReceivesApplicationLogs() {
        appender.attach();
        try {
            Logger logger = LogManager.getLogger("com.phillippitts.observability.AttachProbe");
            logger.info("bridged message");

            await().atMost(3, SECONDS).until(() -> storage.entries().stream()
                    .anyMatch(entry -> entry.message().equals("bridged message")));
        } finally {
            appender.detach();
        }
    }

    private static LogEvent event(String loggerName, Level level, String message, Throwable thrown) {
        return Log4jLogEvent.newBuilder()
                .setLoggerName(loggerName)
                .setLevel(level)
                .setMessage(new SimpleMessage(message))
                .setThrown(thrown)
                .setThreadName("test-thread")
                .setTimeMillis(Instant.parse("2025-01-01T00:00:00Z").toEpochMilli())
                .build();
    }
}
