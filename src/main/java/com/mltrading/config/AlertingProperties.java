package com.mltrading.config;

import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.enums.AlertSeverity;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized alerting configuration, bound from application.yml:
 * <pre>
 * mltrading.alerts.enabled=true
 * mltrading.alerts.min-severity=MEDIUM
 * mltrading.alerts.rate-limiting.max-alerts-per-hour=10
 * mltrading.alerts.categories.trading-errors.severity=HIGH
 * mltrading.alerts.email.enabled=false
 * mltrading.alerts.email.recipient=${ALERT_RECIPIENT_EMAIL:}
 * </pre>
 *
 * <p>This mutable binding object is only read once, by {@link #toSnapshot()}; the
 * alerting core works on the resulting immutable {@link AlertConfig}. Sender
 * credentials are not bound here: see {@code EmailCredentials}.
 */
@Data
@ConfigurationProperties(prefix = "mltrading.alerts")
public class AlertingProperties {

    private boolean enabled = true;
    private String minSeverity = "MEDIUM";
    private String zoneId;
    private boolean lifecycleAlerts = false;
    private RateLimiting rateLimiting = new RateLimiting();
    private Map<String, Category> categories = new LinkedHashMap<>();
    private Email email = new Email();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Fallback fallback = new Fallback();

    /**
     * Converts the bound properties into the immutable snapshot. Unknown severity or
     * category names fail here, at startup, rather than silently mis-filtering later.
     */
    public AlertConfig toSnapshot() {
        Map<AlertCategory, AlertConfig.CategorySettings> categorySettings = new EnumMap<>(AlertCategory.class);
        categories.forEach((key, category) -> categorySettings.put(
                AlertCategory.fromKey(key),
                AlertConfig.CategorySettings.builder()
                        .enabled(category.isEnabled())
                        .severity(AlertSeverity.fromString(category.getSeverity()))
                        .rateLimited(category.isRateLimited())
                        .build()));

        return AlertConfig.builder()
                .enabled(enabled)
                .minSeverity(AlertSeverity.fromString(minSeverity))
                .zoneId(zoneId == null || zoneId.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zoneId))
                .lifecycleAlerts(lifecycleAlerts)
                .rateLimiting(AlertConfig.RateLimitSettings.builder()
                        .enabled(rateLimiting.isEnabled())
                        .maxAlertsPerHour(rateLimiting.getMaxAlertsPerHour())
                        .maxAlertsPerDay(rateLimiting.getMaxAlertsPerDay())
                        .build())
                .categories(Map.copyOf(categorySettings))
                .email(AlertConfig.EmailSettings.builder()
                        .enabled(email.isEnabled())
                        .smtpServer(email.getSmtpServer())
                        .smtpPort(email.getSmtpPort())
                        .useTls(email.isUseTls())
                        .timeout(email.getTimeout())
                        .recipient(email.getRecipient())
                        .build())
                .circuitBreaker(AlertConfig.CircuitBreakerSettings.builder()
                        .failureThreshold(circuitBreaker.getFailureThreshold())
                        .recoveryTimeout(circuitBreaker.getRecoveryTimeout())
                        .build())
                .fallbackPath(Path.of(fallback.getPath()))
                .build();
    }

    @Data
    public static class RateLimiting {
        private boolean enabled = true;
        private int maxAlertsPerHour = 10;
        private int maxAlertsPerDay = 50;
    }

    @Data
    public static class Category {
        private boolean enabled = true;
        private String severity = "MEDIUM";
        private boolean rateLimited = true;
    }

    @Data
    public static class Email {
        private boolean enabled = false;
        private String smtpServer = "smtp.mail.yahoo.com";
        private int smtpPort = 587;
        private boolean useTls = true;
        private Duration timeout = Duration.ofSeconds(30);
        private String recipient;
    }

    @Data
    public static class CircuitBreaker {
        private int failureThreshold = 3;
        private Duration recoveryTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Fallback {
        private String path = "logs/alerts-fallback.jsonl";
    }
}
