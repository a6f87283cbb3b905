package com.phillippitts.observability.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the telemetry write pool via Micrometer.
 *
 * <ul>
 *   <li>telemetry.pool.size - Current number of threads in the pool</li>
 *   <li>telemetry.pool.active - Number of writes executing</li>
 *   <li>telemetry.pool.queued - Number of writes waiting in the queue</li>
 *   <li>telemetry.pool.completed - Cumulative count of completed writes</li>
 * </ul>
 *
 * <p>A sustained non-zero queue means storage is slower than the request rate; writes will start
 * timing out (see {@code observability.write.failures}).
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> telemetryExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("telemetryExecutor") ObjectProvider<ThreadPoolTaskExecutor> telemetryExecutorProvider) {
        this.telemetryExecutorProvider = telemetryExecutorProvider;
    }

    @Bean
    public MeterBinder telemetryExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = telemetryExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("telemetry.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the telemetry pool")
                    .register(registry);

            Gauge.builder("telemetry.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of storage writes executing")
                    .register(registry);

            Gauge.builder("telemetry.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of storage writes waiting in the queue")
                    .register(registry);

            Gauge.builder("telemetry.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed storage writes")
                    .register(registry);

            LOG.info("Telemetry pool metrics registered: telemetry.pool.* available via /actuator/prometheus");
        };
    }

    /**
     * Logs a telemetry pool health summary every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = telemetryExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Telemetry Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
