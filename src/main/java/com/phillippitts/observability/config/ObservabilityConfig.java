package com.phillippitts.observability.config;

import com.phillippitts.observability.config.logging.LogStorageAppender;
import com.phillippitts.observability.config.properties.MiddlewareProperties;
import com.phillippitts.observability.config.properties.StorageProperties;
import com.phillippitts.observability.service.pipeline.InstrumentationPipeline;
import com.phillippitts.observability.service.storage.InMemoryMetricsStorage;
import com.phillippitts.observability.service.storage.LogStoragePort;
import com.phillippitts.observability.service.storage.MetricsStoragePort;
import com.phillippitts.observability.service.storage.MicrometerMetricsStorage;
import com.phillippitts.observability.service.storage.RingBufferLogStorage;
import com.phillippitts.observability.service.write.TimedWriter;
import com.phillippitts.observability.service.write.WriteDiagnostics;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires storage adapters, the timed writer and the instrumentation pipeline.
 *
 * <p>Metrics backend is selected via {@code observability.storage.metrics-backend}:
 * {@code MICROMETER} (default, scraped from {@code /actuator/prometheus}) or {@code IN_MEMORY}.
 */
@Configuration
public class ObservabilityConfig {

    private static final Logger LOG = LogManager.getLogger(ObservabilityConfig.class);

    @Bean
    public LogStoragePort logStorage(StorageProperties props) {
        LOG.info("Log storage: ring buffer, capacity={}", props.getLogCapacity());
        return new RingBufferLogStorage(props.getLogCapacity());
    }

    @Bean
    public MetricsStoragePort metricsStorage(StorageProperties props, MeterRegistry registry) {
        LOG.info("Metrics storage: {}", props.getMetricsBackend());
        if (props.getMetricsBackend() == StorageProperties.MetricsBackend.IN_MEMORY) {
            return new InMemoryMetricsStorage();
        }
        return new MicrometerMetricsStorage(registry);
    }

    @Bean
    public TimedWriter timedWriter(@Qualifier("telemetryExecutor") Executor telemetryExecutor) {
        return new TimedWriter(telemetryExecutor);
    }

    @Bean
    public WriteDiagnostics writeDiagnostics(MeterRegistry registry) {
        return new WriteDiagnostics(registry);
    }

    @Bean
    public InstrumentationPipeline instrumentationPipeline(MiddlewareProperties props,
                                                           LogStoragePort logStorage,
                                                           MetricsStoragePort metricsStorage,
                                                           TimedWriter timedWriter,
                                                           WriteDiagnostics diagnostics) {
        return new InstrumentationPipeline(props.toConfig(), logStorage, metricsStorage, timedWriter, diagnostics);
    }

    /**
     * Bridges application log events into the log storage for the lifetime of the context.
     */
    @Bean(initMethod = "attach", destroyMethod = "detach")
    public LogStorageAppender logStorageAppender(LogStoragePort logStorage,
                                                 TimedWriter timedWriter,
                                                 WriteDiagnostics diagnostics,
                                                 MiddlewareProperties props) {
        return new LogStorageAppender(logStorage, timedWriter, props.getWriteTimeout(), diagnostics);
    }
}
