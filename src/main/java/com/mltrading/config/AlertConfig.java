package com.mltrading.config;

import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.enums.AlertSeverity;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable configuration snapshot consumed by the alerting core.
 *
 * <p>Built once from {@link AlertingProperties} at startup. Reconfiguration builds a
 * new snapshot and swaps it in through {@link AlertConfigHolder}; fields of a live
 * snapshot are never changed. Sender credentials are not part of the snapshot: they are
 * read from the environment by the transport.
 */
@Value
@Builder(toBuilder = true)
public class AlertConfig {

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    AlertSeverity minSeverity = AlertSeverity.MEDIUM;

    /** Zone whose local midnight starts the daily rate-limit window. */
    @Builder.Default
    ZoneId zoneId = ZoneId.systemDefault();

    @Builder.Default
    boolean lifecycleAlerts = false;

    @Builder.Default
    RateLimitSettings rateLimiting = RateLimitSettings.builder().build();

    @Builder.Default
    Map<AlertCategory, CategorySettings> categories = Map.of();

    @Builder.Default
    EmailSettings email = EmailSettings.builder().build();

    @Builder.Default
    CircuitBreakerSettings circuitBreaker = CircuitBreakerSettings.builder().build();

    @Builder.Default
    Path fallbackPath = Path.of("logs", "alerts-fallback.jsonl");

    public static AlertConfig defaults() {
        return AlertConfig.builder().build();
    }

    /** Settings for one category; categories missing from config use {@link CategorySettings#DEFAULT}. */
    public CategorySettings category(AlertCategory category) {
        return categories.getOrDefault(category, CategorySettings.DEFAULT);
    }

    public boolean isCategoryEnabled(AlertCategory category) {
        return category(category).isEnabled();
    }

    public Map<AlertCategory, Boolean> categoriesEnabled() {
        Map<AlertCategory, Boolean> result = new EnumMap<>(AlertCategory.class);
        for (AlertCategory category : AlertCategory.values()) {
            result.put(category, isCategoryEnabled(category));
        }
        return Collections.unmodifiableMap(result);
    }

    @Value
    @Builder(toBuilder = true)
    public static class RateLimitSettings {

        @Builder.Default
        boolean enabled = true;

        @Builder.Default
        int maxAlertsPerHour = 10;

        @Builder.Default
        int maxAlertsPerDay = 50;
    }

    @Value
    @Builder(toBuilder = true)
    public static class CategorySettings {

        public static final CategorySettings DEFAULT = CategorySettings.builder().build();

        @Builder.Default
        boolean enabled = true;

        /** Severity used by the typed shorthands when the caller passes none. */
        @Builder.Default
        AlertSeverity severity = AlertSeverity.MEDIUM;

        /** False exempts the category from rate limiting. */
        @Builder.Default
        boolean rateLimited = true;
    }

    @Value
    @Builder(toBuilder = true)
    public static class EmailSettings {

        @Builder.Default
        boolean enabled = false;

        @Builder.Default
        String smtpServer = "smtp.mail.yahoo.com";

        @Builder.Default
        int smtpPort = 587;

        @Builder.Default
        boolean useTls = true;

        @Builder.Default
        Duration timeout = Duration.ofSeconds(30);

        String recipient;
    }

    @Value
    @Builder(toBuilder = true)
    public static class CircuitBreakerSettings {

        @Builder.Default
        int failureThreshold = 3;

        @Builder.Default
        Duration recoveryTimeout = Duration.ofMinutes(5);
    }
}
