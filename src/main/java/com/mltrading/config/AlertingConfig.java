package com.mltrading.config;

import com.mltrading.alerting.AlertStatsRecorder;
import com.mltrading.alerting.breaker.TransportCircuitBreaker;
import com.mltrading.alerting.fallback.FallbackSink;
import com.mltrading.alerting.fallback.FileFallbackSink;
import com.mltrading.alerting.ratelimit.AlertRateLimiter;
import com.mltrading.alerting.transport.AlertEmailRenderer;
import com.mltrading.alerting.transport.DisabledEmailTransport;
import com.mltrading.alerting.transport.EmailCredentials;
import com.mltrading.alerting.transport.EmailTransport;
import com.mltrading.alerting.transport.SmtpEmailTransport;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Wires the alerting core from {@link AlertingProperties}.
 *
 * <p>The properties are converted once into the immutable {@link AlertConfig}
 * snapshot held by {@link AlertConfigHolder}. The transport is chosen at startup:
 * SMTP when {@code email.enabled} is true, otherwise a transport that refuses every
 * send. Circuit-breaker thresholds are read from the startup snapshot only.
 */
@Configuration
@EnableConfigurationProperties(AlertingProperties.class)
public class AlertingConfig {

    private static final Logger log = LoggerFactory.getLogger(AlertingConfig.class);

    static final String TRANSPORT_BREAKER_NAME = "emailTransport";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AlertConfigHolder alertConfigHolder(AlertingProperties properties) {
        AlertConfig config = properties.toSnapshot();
        log.info(
                "Alerting configured: enabled={} minSeverity={} email={} rateLimit={}/h {}/day",
                config.isEnabled(),
                config.getMinSeverity(),
                config.getEmail().isEnabled(),
                config.getRateLimiting().getMaxAlertsPerHour(),
                config.getRateLimiting().getMaxAlertsPerDay());
        return new AlertConfigHolder(config);
    }

    @Bean
    public AlertEmailRenderer alertEmailRenderer(Clock clock) {
        return new AlertEmailRenderer(clock);
    }

    @Bean
    public EmailTransport emailTransport(
            AlertConfigHolder configHolder, Environment environment, AlertEmailRenderer renderer) {
        AlertConfig.EmailSettings email = configHolder.current().getEmail();
        if (!email.isEnabled()) {
            log.info("E-mail alerts disabled; alerts that pass filtering will be logged to the fallback sink");
            return new DisabledEmailTransport();
        }
        return new SmtpEmailTransport(email, EmailCredentials.fromEnvironment(environment), renderer);
    }

    @Bean
    public TransportCircuitBreaker transportCircuitBreaker(
            AlertConfigHolder configHolder, CircuitBreakerRegistry circuitBreakerRegistry, Clock clock) {
        return new TransportCircuitBreaker(
                TRANSPORT_BREAKER_NAME, configHolder.current().getCircuitBreaker(), circuitBreakerRegistry, clock);
    }

    @Bean
    public AlertRateLimiter alertRateLimiter(AlertConfigHolder configHolder, Clock clock) {
        return new AlertRateLimiter(configHolder, clock);
    }

    @Bean
    public FallbackSink fallbackSink(AlertConfigHolder configHolder, Clock clock) {
        return new FileFallbackSink(configHolder.current().getFallbackPath(), clock);
    }

    @Bean
    public AlertStatsRecorder alertStatsRecorder(MeterRegistry meterRegistry) {
        return new AlertStatsRecorder(meterRegistry);
    }
}
