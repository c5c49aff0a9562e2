package com.solarcharge.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Common tags for every meter. Coordinator meters are defined in
 * {@link com.solarcharge.observability.CoordinatorMetricsService}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> commonTags(
            @Value("${spring.application.name:solar-charge-coordinator}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }
}
