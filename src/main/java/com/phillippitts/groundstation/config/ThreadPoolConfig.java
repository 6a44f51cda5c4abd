package com.phillippitts.groundstation.config;

import com.phillippitts.groundstation.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the long-running worker threads of the ground station.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on the expected number of satellites.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor running one output-delivery loop per satellite session.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.delivery.*} properties:
     * <ul>
     *   <li>Core pool: default 4 - a handful of satellites in a typical home</li>
     *   <li>Max pool: default 64 - hard ceiling on concurrent sessions</li>
     *   <li>No queue: a delivery loop never finishes on its own, so queued loops would starve</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A rejected loop fails the
     * session setup instead of running the loop on a WebSocket container thread.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (sessionId, room) from the submitting
     * thread to the worker thread.
     *
     * @return Configured executor for delivery loops
     */
    @Bean(name = "deliveryExecutor")
    public Executor deliveryExecutor() {
        ThreadPoolProperties.DeliveryPoolProperties props = threadPoolProperties.getDelivery();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    /**
     * Single-thread executor hosting the broker connect/listen loop for the whole process.
     *
     * @return Configured executor for the broker listener
     */
    @Bean(name = "brokerListenerExecutor")
    public Executor brokerListenerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix(threadPoolProperties.getListenerThreadName() + "-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    private static TaskDecorator threadContextPropagation() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                }
            };
        };
    }
}
