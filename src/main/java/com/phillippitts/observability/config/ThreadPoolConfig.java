package com.phillippitts.observability.config;

import com.phillippitts.observability.config.properties.ThreadPoolProperties;
import com.phillippitts.observability.service.context.RequestContextTaskDecorator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by request instrumentation.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded pool that runs storage writes for the timed writer.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.telemetry.*} properties:
     * <ul>
     *   <li>Core pool: default 2 - writes are short</li>
     *   <li>Max pool: default 8 - absorbs slow storage</li>
     *   <li>Queue: default 1000 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}
     * When the pool and queue are full the write is rejected and reported as failed; request
     * threads never run storage writes themselves.
     *
     * @return executor for storage writes
     */
    @Bean(name = "telemetryExecutor")
    public ThreadPoolTaskExecutor telemetryExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getTelemetry();

        ThreadPoolTaskExecutor executor = newExecutor(props);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        // Pending writes are best effort; do not hold shutdown for them
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Creates a pool for handlers that offload work within a request.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the caller thread executes the task,
     * providing backpressure instead of failing fast.
     *
     * <p>Context propagation: tasks run with the submitting request's context bound and the
     * submitter's Log4j2 ThreadContext copied, so logs written by the task keep the request id.
     *
     * @return executor for application work
     */
    @Bean(name = "applicationExecutor")
    public ThreadPoolTaskExecutor applicationExecutor() {
        ThreadPoolProperties.PoolProperties props = threadPoolProperties.getApplication();

        ThreadPoolTaskExecutor executor = newExecutor(props);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(new RequestContextTaskDecorator());
        executor.initialize();
        return executor;
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        return executor;
    }
}
