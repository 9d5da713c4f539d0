package com.mltrading.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application name, so the {@code alerts.processed}
 * counters from {@link com.mltrading.alerting.AlertStatsRecorder} can be told apart
 * from other MLTrading services on a shared backend.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> alertingCommonTags(
            @Value("${spring.application.name:mltrading-alerting}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }
}
