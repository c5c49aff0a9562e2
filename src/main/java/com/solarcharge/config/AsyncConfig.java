package com.solarcharge.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for {@code @Async} event listeners (system log persistence).
 *
 * <p>Events are mostly published from the coordinator worker, so a saturated pool drops
 * the task with a warning instead of running it on the publishing thread. System log
 * entries are best-effort.
 */
@Configuration
@EnableAsync
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    public static final String EVENT_EXECUTOR = "eventExecutor";
    public static final String CONTROL_PUBLISH_EXECUTOR = "controlPublishExecutor";

    private final int corePoolSize;
    private final int maxPoolSize;
    private final int queueCapacity;
    private final int publishQueueCapacity;

    public AsyncConfig(
            @Value("${solarcharge.async.core-pool-size:2}") int corePoolSize,
            @Value("${solarcharge.async.max-pool-size:4}") int maxPoolSize,
            @Value("${solarcharge.async.queue-capacity:500}") int queueCapacity,
            @Value("${solarcharge.mqtt.publish-queue-capacity:1000}") int publishQueueCapacity) {
        this.corePoolSize = corePoolSize;
        this.maxPoolSize = maxPoolSize;
        this.queueCapacity = queueCapacity;
        this.publishQueueCapacity = publishQueueCapacity;
    }

    @Bean(EVENT_EXECUTOR)
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("event-");
        executor.setRejectedExecutionHandler(dropWithWarning());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }

    /**
     * Single thread for outbound control publishes and their retries. One thread keeps
     * ON/OFF commands in submission order. A full queue rejects the command, which the
     * sender reports as not accepted.
     */
    @Bean(CONTROL_PUBLISH_EXECUTOR)
    public ThreadPoolTaskExecutor controlPublishExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(publishQueueCapacity);
        executor.setThreadNamePrefix("control-publish-");
        // Shut down by ControlCommandSender before the MQTT client is closed
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(20);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger listenerLog = LoggerFactory.getLogger(method.getDeclaringClass());
            listenerLog.error("Async listener {} failed: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }

    static RejectedExecutionHandler dropWithWarning() {
        return (task, executor) -> log.warn(
                "Event executor saturated, task dropped: active={}, queued={}",
                executor.getActiveCount(),
                executor.getQueue().size());
    }
}
