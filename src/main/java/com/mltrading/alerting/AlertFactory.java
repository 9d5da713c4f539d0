package com.mltrading.alerting;

import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.enums.AlertSeverity;
import com.mltrading.domain.model.Alert;
import com.mltrading.domain.model.AlertValidator;
import com.mltrading.exception.AlertValidationException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builders for the alerts producers raise most often.
 *
 * <p>All methods are pure: they allocate an {@link Alert} and touch no shared state.
 * Invalid input (blank text, non-representable metadata, non-finite numbers) throws
 * {@link AlertValidationException} before anything reaches the alert pipeline.
 *
 * <p>Severity and category are fixed per builder. {@link #createSecurityAlert} always
 * yields CRITICAL / SECURITY and offers no way to override either.
 */
public final class AlertFactory {

    public static final String DEFAULT_TRADING_COMPONENT = "TradingSystem";

    private AlertFactory() {}

    public static Alert createAlert(
            String title,
            String message,
            AlertSeverity severity,
            AlertCategory category,
            String component,
            Map<String, ?> metadata) {
        return Alert.builder()
                .title(title)
                .message(message)
                .severity(severity)
                .category(category)
                .component(component)
                .metadata(metadata)
                .build();
    }

    // ---- Trading ----

    public static Alert createTradingErrorAlert(String errorMessage, String component, Map<String, ?> metadata) {
        return createTradingErrorAlert(errorMessage, component, "Trading Error", metadata);
    }

    public static Alert createTradingErrorAlert(
            String errorMessage, String component, String errorType, Map<String, ?> metadata) {
        AlertValidator.requireText(component, "component");
        return createAlert(
                errorType + " in " + component,
                errorMessage,
                AlertSeverity.HIGH,
                AlertCategory.TRADING_ERRORS,
                component,
                metadata);
    }

    public static Alert createOrderFailureAlert(
            String symbol, String orderType, String errorMessage, Map<String, ?> metadata) {
        return createOrderFailureAlert(symbol, orderType, errorMessage, DEFAULT_TRADING_COMPONENT, metadata);
    }

    public static Alert createOrderFailureAlert(
            String symbol, String orderType, String errorMessage, String component, Map<String, ?> metadata) {
        AlertValidator.requireText(symbol, "symbol");
        AlertValidator.requireText(orderType, "order type");
        AlertValidator.requireText(errorMessage, "error message");

        Map<String, Object> merged = merge(metadata);
        merged.put("symbol", symbol);
        merged.put("order_type", orderType);

        return createAlert(
                "Order Failure: " + orderType + " " + symbol,
                "Failed to execute " + orderType + " order for " + symbol + ": " + errorMessage,
                AlertSeverity.HIGH,
                AlertCategory.TRADING_ERRORS,
                component,
                merged);
    }

    // ---- System health ----

    /**
     * Threshold-breach alert whose severity grows with the size of the breach:
     * ratio {@code currentValue / threshold} up to 1.0 is LOW, below 1.5 MEDIUM,
     * below 2.0 HIGH, and CRITICAL from 2.0.
     *
     * @throws AlertValidationException if the threshold is not a finite positive number
     *     or the current value is not finite
     */
    public static Alert createPerformanceAlert(
            String metricName, double currentValue, double threshold, String component) {
        return createPerformanceAlert(metricName, currentValue, threshold, component, null);
    }

    public static Alert createPerformanceAlert(
            String metricName, double currentValue, double threshold, String component, Map<String, ?> metadata) {
        AlertValidator.requireText(metricName, "metric name");
        AlertSeverity severity = severityForBreach(currentValue, threshold);

        Map<String, Object> merged = merge(metadata);
        merged.put("metric", metricName);
        merged.put("current_value", currentValue);
        merged.put("threshold", threshold);

        String message = currentValue > threshold
                ? metricName + " has exceeded threshold: " + currentValue + " > " + threshold
                : metricName + " is at " + currentValue + " (threshold " + threshold + ")";

        return createAlert(
                "Performance Alert: " + metricName,
                message,
                severity,
                AlertCategory.SYSTEM_HEALTH,
                component,
                merged);
    }

    static AlertSeverity severityForBreach(double currentValue, double threshold) {
        if (!Double.isFinite(threshold) || threshold <= 0) {
            throw new AlertValidationException("Performance threshold must be a finite positive number: " + threshold);
        }
        if (!Double.isFinite(currentValue)) {
            throw new AlertValidationException("Performance value must be finite: " + currentValue);
        }
        double ratio = currentValue / threshold;
        if (ratio <= 1.0) {
            return AlertSeverity.LOW;
        }
        if (ratio < 1.5) {
            return AlertSeverity.MEDIUM;
        }
        if (ratio < 2.0) {
            return AlertSeverity.HIGH;
        }
        return AlertSeverity.CRITICAL;
    }

    public static Alert createDatabaseConnectionAlert(String errorMessage, String component, Map<String, ?> metadata) {
        AlertValidator.requireText(errorMessage, "error message");
        return createAlert(
                "Database Connection Error",
                "Database connection failed: " + errorMessage,
                AlertSeverity.HIGH,
                AlertCategory.SYSTEM_HEALTH,
                component != null ? component : "Database",
                metadata);
    }

    public static Alert createApiErrorAlert(
            String apiName, String errorMessage, String component, Map<String, ?> metadata) {
        AlertValidator.requireText(apiName, "API name");
        return createAlert(
                "API Error: " + apiName,
                errorMessage,
                AlertSeverity.MEDIUM,
                AlertCategory.SYSTEM_HEALTH,
                component,
                metadata);
    }

    public static Alert createCircuitBreakerAlert(String serviceName, String component, Map<String, ?> metadata) {
        AlertValidator.requireText(serviceName, "service name");
        return createAlert(
                "Circuit Breaker Opened: " + serviceName,
                "Circuit breaker for " + serviceName + " has been opened due to repeated failures",
                AlertSeverity.HIGH,
                AlertCategory.SYSTEM_HEALTH,
                component,
                metadata);
    }

    public static Alert createSystemStartupAlert(String component, String version, Map<String, ?> metadata) {
        AlertValidator.requireText(component, "component");
        String versionText = version != null && !version.isBlank() ? " (v" + version + ")" : "";
        return createAlert(
                "System Started: " + component + versionText,
                component + " has started successfully and is ready to process requests",
                AlertSeverity.INFO,
                AlertCategory.SYSTEM_HEALTH,
                component,
                metadata);
    }

    public static Alert createSystemShutdownAlert(String component, String reason, Map<String, ?> metadata) {
        AlertValidator.requireText(component, "component");
        String shutdownReason = reason != null && !reason.isBlank() ? reason : "Normal shutdown";
        return createAlert(
                "System Shutdown: " + component,
                component + " is shutting down: " + shutdownReason,
                AlertSeverity.MEDIUM,
                AlertCategory.SYSTEM_HEALTH,
                component,
                metadata);
    }

    // ---- Data pipeline ----

    public static Alert createDataPipelineErrorAlert(
            String pipelineName, String errorMessage, String component, Map<String, ?> metadata) {
        AlertValidator.requireText(pipelineName, "pipeline name");
        return createAlert(
                "Data Pipeline Error: " + pipelineName,
                errorMessage,
                AlertSeverity.MEDIUM,
                AlertCategory.DATA_PIPELINE,
                component,
                metadata);
    }

    public static Alert createFeatureEngineeringAlert(
            String pipelineName, String message, AlertSeverity severity, String component, Map<String, ?> metadata) {
        AlertValidator.requireText(pipelineName, "pipeline name");
        return createAlert(
                "Feature Engineering: " + pipelineName,
                message,
                severity != null ? severity : AlertSeverity.MEDIUM,
                AlertCategory.DATA_PIPELINE,
                component != null ? component : "FeatureEngineering",
                metadata);
    }

    public static Alert createDataFreshnessAlert(
            String dataSource, Instant lastUpdate, Duration maxAge, String component, Map<String, ?> metadata) {
        return createDataFreshnessAlert(dataSource, lastUpdate, maxAge, component, metadata, Clock.systemUTC());
    }

    public static Alert createDataFreshnessAlert(
            String dataSource,
            Instant lastUpdate,
            Duration maxAge,
            String component,
            Map<String, ?> metadata,
            Clock clock) {
        AlertValidator.requireText(dataSource, "data source");
        AlertValidator.requirePresent(lastUpdate, "last update");
        AlertValidator.requirePresent(maxAge, "max age");

        double hoursOld = Duration.between(lastUpdate, clock.instant()).toMinutes() / 60.0;
        double roundedHours = Math.round(hoursOld * 10) / 10.0;

        Map<String, Object> merged = merge(metadata);
        merged.put("data_source", dataSource);
        merged.put("last_update", lastUpdate.toString());
        merged.put("hours_old", roundedHours);
        merged.put("threshold_hours", maxAge.toHours());

        return createAlert(
                "Stale Data Alert: " + dataSource,
                String.format(
                        Locale.ROOT,
                        "Data from %s is %.1f hours old (threshold: %dh)",
                        dataSource,
                        hoursOld,
                        maxAge.toHours()),
                AlertSeverity.MEDIUM,
                AlertCategory.DATA_PIPELINE,
                component != null ? component : "DataMonitor",
                merged);
    }

    // ---- Security ----

    public static Alert createSecurityAlert(String title, String message, String component) {
        return createSecurityAlert(title, message, component, null);
    }

    public static Alert createSecurityAlert(String title, String message, String component, Map<String, ?> metadata) {
        AlertValidator.requireText(title, "title");
        return createAlert(
                "Security Alert: " + title,
                message,
                AlertSeverity.CRITICAL,
                AlertCategory.SECURITY,
                component,
                metadata);
    }

    private static Map<String, Object> merge(Map<String, ?> metadata) {
        return metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }
}
