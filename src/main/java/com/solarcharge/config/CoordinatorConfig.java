package com.solarcharge.config;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Wires the coordinator's single worker thread and its settings.
 *
 * <p>The coordinator scheduler is the only {@code TaskScheduler} in the context, so
 * {@code @Scheduled} methods run on it too. Telemetry handling, control requests,
 * inactivity timers and reconciler sweeps are therefore serialized on one thread.
 */
@Configuration
public class CoordinatorConfig {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorConfig.class);

    public static final String WORKER_THREAD_PREFIX = "coordinator-";

    @Bean("coordinatorScheduler")
    public ThreadPoolTaskScheduler coordinatorScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(WORKER_THREAD_PREFIX);
        scheduler.setRemoveOnCancelPolicy(true);
        // Pending timers must not run once the worker is shut down
        scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        scheduler.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        scheduler.setErrorHandler(t -> log.error("Unhandled error on coordinator worker", t));
        // Shut down explicitly by GracefulShutdownService after timers are cancelled
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public CoordinatorSettings coordinatorSettings(
            @Value("${solarcharge.session.inactivity-timeout-seconds:60}") long inactivityTimeoutSeconds,
            @Value("${solarcharge.session.sample-interval-seconds:10}") int sampleIntervalSeconds,
            @Value("${solarcharge.session.nominal-voltage:12}") double nominalVoltage,
            @Value("${solarcharge.session.max-consumption-watts:10000}") double maxConsumptionWatts,
            @Value("${solarcharge.pricing.default-price-per-kwh:0.25}") BigDecimal defaultPricePerKwh) {
        return CoordinatorSettings.builder()
                .inactivityTimeout(Duration.ofSeconds(inactivityTimeoutSeconds))
                .sampleIntervalSeconds(sampleIntervalSeconds)
                .nominalVoltage(nominalVoltage)
                .maxConsumptionWatts(maxConsumptionWatts)
                .defaultPricePerKwh(defaultPricePerKwh)
                .build();
    }
}
