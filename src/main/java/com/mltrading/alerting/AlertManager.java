package com.mltrading.alerting;

import com.mltrading.alerting.breaker.TransportCircuitBreaker;
import com.mltrading.alerting.fallback.FallbackSink;
import com.mltrading.alerting.ratelimit.AlertRateLimiter;
import com.mltrading.alerting.transport.EmailTransport;
import com.mltrading.config.AlertConfig;
import com.mltrading.config.AlertConfigHolder;
import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.enums.AlertOutcome;
import com.mltrading.domain.enums.AlertSeverity;
import com.mltrading.domain.model.Alert;
import com.mltrading.domain.model.AlertStats;
import com.mltrading.domain.model.AlertSystemStatus;
import com.mltrading.exception.AlertValidationException;
import com.mltrading.exception.CircuitOpenException;
import com.mltrading.exception.TransportException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for every producer that raises an alert.
 *
 * <p>{@link #process(Alert)} runs the alert through, in order: the global enable
 * switch, the minimum-severity filter, the per-category enable flag (bypassed by
 * CRITICAL security alerts), the category's rate-limit budget, and finally the
 * circuit-broken transport. An unconfigured transport fails the alert before the
 * breaker is entered, so it never counts as a transport failure. The first stage that rejects the alert decides the
 * {@link AlertOutcome}. Every outcome other than SENT also goes to the
 * {@link FallbackSink}.
 *
 * <p>Apart from {@link AlertValidationException} thrown while building an alert in
 * the convenience methods, nothing here throws to the producer: transport errors,
 * an open breaker and fallback write failures are logged and reflected in the
 * outcome and the stats.
 *
 * <p>Delivery is synchronous on the caller's thread, bounded by the transport
 * timeout. Safe for concurrent use.
 */
@Service
public class AlertManager {

    private static final Logger log = LoggerFactory.getLogger(AlertManager.class);

    private final AlertConfigHolder configHolder;
    private final AlertRateLimiter rateLimiter;
    private final TransportCircuitBreaker circuitBreaker;
    private final EmailTransport emailTransport;
    private final FallbackSink fallbackSink;
    private final AlertStatsRecorder statsRecorder;

    public AlertManager(
            AlertConfigHolder configHolder,
            AlertRateLimiter rateLimiter,
            TransportCircuitBreaker circuitBreaker,
            EmailTransport emailTransport,
            FallbackSink fallbackSink,
            AlertStatsRecorder statsRecorder) {
        this.configHolder = configHolder;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.emailTransport = emailTransport;
        this.fallbackSink = fallbackSink;
        this.statsRecorder = statsRecorder;
    }

    /**
     * Runs one alert through the pipeline and reports what happened to it.
     */
    public AlertOutcome process(Alert alert) {
        AlertConfig config = configHolder.current();
        statsRecorder.recordReceived(alert);

        AlertOutcome outcome;
        if (!config.isEnabled()) {
            outcome = reject(alert, AlertOutcome.DISABLED, "alerting disabled");
        } else if (alert.getSeverity().isBelow(config.getMinSeverity())) {
            outcome = reject(
                    alert,
                    AlertOutcome.FILTERED_SEVERITY,
                    "severity " + alert.getSeverity() + " below minimum " + config.getMinSeverity());
        } else if (!config.isCategoryEnabled(alert.getCategory()) && !alert.isForcedSecurityAlert()) {
            outcome = reject(
                    alert,
                    AlertOutcome.FILTERED_CATEGORY,
                    "category " + alert.getCategory().getKey() + " disabled");
        } else if (!rateLimiter.allow(alert.getCategory())) {
            log.warn("Rate limit exceeded for {}: {}", alert.getCategory().getKey(), alert.getTitle());
            outcome = reject(alert, AlertOutcome.RATE_LIMITED, "rate limited");
        } else {
            outcome = deliver(alert);
        }

        statsRecorder.recordOutcome(alert, outcome);
        return outcome;
    }

    /** Same as {@link #process(Alert)}. */
    public AlertOutcome processAlert(Alert alert) {
        return process(alert);
    }

    // ---- Convenience senders ----

    public AlertOutcome sendAlert(
            String title,
            String message,
            AlertSeverity severity,
            AlertCategory category,
            String component,
            Map<String, ?> metadata) {
        return process(AlertFactory.createAlert(title, message, severity, category, component, metadata));
    }

    public AlertOutcome sendTradingErrorAlert(String errorMessage, String component, Map<String, ?> metadata) {
        return process(AlertFactory.createTradingErrorAlert(errorMessage, component, metadata));
    }

    public AlertOutcome sendOrderFailureAlert(
            String symbol, String orderType, String errorMessage, String component, Map<String, ?> metadata) {
        String sourceComponent = component != null ? component : AlertFactory.DEFAULT_TRADING_COMPONENT;
        return process(AlertFactory.createOrderFailureAlert(symbol, orderType, errorMessage, sourceComponent, metadata));
    }

    /**
     * System-health alert; a null severity takes the category's configured default.
     */
    public AlertOutcome sendSystemHealthAlert(
            String title, String message, AlertSeverity severity, String component, Map<String, ?> metadata) {
        return sendAlert(
                title,
                message,
                severityOrDefault(severity, AlertCategory.SYSTEM_HEALTH),
                AlertCategory.SYSTEM_HEALTH,
                component,
                metadata);
    }

    /**
     * Data-pipeline alert; a null severity takes the category's configured default.
     */
    public AlertOutcome sendDataPipelineAlert(
            String title, String message, AlertSeverity severity, String component, Map<String, ?> metadata) {
        return sendAlert(
                title,
                message,
                severityOrDefault(severity, AlertCategory.DATA_PIPELINE),
                AlertCategory.DATA_PIPELINE,
                component,
                metadata);
    }

    public AlertOutcome sendPerformanceAlert(
            String metricName, double currentValue, double threshold, String component) {
        return process(AlertFactory.createPerformanceAlert(metricName, currentValue, threshold, component));
    }

    public AlertOutcome sendSecurityAlert(String title, String message, String component, Map<String, ?> metadata) {
        return process(AlertFactory.createSecurityAlert(title, message, component, metadata));
    }

    public AlertOutcome sendCriticalAlert(
            String title, String message, AlertCategory category, String component, Map<String, ?> metadata) {
        return sendAlert(title, message, AlertSeverity.CRITICAL, category, component, metadata);
    }

    // ---- Queries and operator actions ----

    public AlertSystemStatus getStatus() {
        AlertConfig config = configHolder.current();
        return AlertSystemStatus.builder()
                .enabled(config.isEnabled())
                .transportAvailable(!circuitBreaker.isOpen())
                .transportConfigured(emailTransport.isAvailable())
                .rateLimitingEnabled(rateLimiter.isEnabled())
                .minSeverity(config.getMinSeverity())
                .circuitBreaker(circuitBreaker.snapshot())
                .categoriesEnabled(config.categoriesEnabled())
                .rateLimits(rateLimiter.usage())
                .build();
    }

    public AlertStats getStats() {
        return statsRecorder.snapshot();
    }

    /**
     * Sends a synthetic INFO system-health alert through the full pipeline.
     *
     * @return true only if it was delivered; with a minimum severity above INFO the
     *     test alert is filtered and this returns false
     */
    public boolean testAlertSystem() {
        Alert testAlert = AlertFactory.createAlert(
                "Alert System Test",
                "This is a test alert to verify the alerting system is working correctly.",
                AlertSeverity.INFO,
                AlertCategory.SYSTEM_HEALTH,
                "AlertManager",
                Map.of("test", true));
        AlertOutcome outcome = process(testAlert);
        log.info("Alert system test finished: {}", outcome);
        return outcome.isDelivered();
    }

    public void resetStats() {
        statsRecorder.reset();
        log.info("Alert statistics reset");
    }

    /**
     * Replaces the configuration snapshot. Alerts already being processed finish
     * under the snapshot they started with. Circuit-breaker thresholds are fixed at
     * startup and are not affected.
     */
    public void reconfigure(AlertConfig config) {
        configHolder.swap(config);
    }

    private AlertSeverity severityOrDefault(AlertSeverity severity, AlertCategory category) {
        return severity != null ? severity : configHolder.current().category(category).getSeverity();
    }

    private AlertOutcome deliver(Alert alert) {
        if (!emailTransport.isAvailable()) {
            log.debug("E-mail transport not configured, alert not sent: {}", alert.getTitle());
            writeFallback(alert, "transport not configured");
            return AlertOutcome.FAILED;
        }
        try {
            circuitBreaker.call(() -> emailTransport.send(alert));
            log.info("Alert sent [{}] {}: {}", alert.getSeverity(), alert.getCategory().getKey(), alert.getTitle());
            return AlertOutcome.SENT;
        } catch (CircuitOpenException e) {
            log.warn(
                    "Transport circuit open, alert not sent (retry in {}s): {}",
                    e.getRetryAfter().toSeconds(),
                    alert.getTitle());
            writeFallback(alert, "circuit breaker open");
        } catch (TransportException e) {
            log.warn("Alert delivery failed ({}): {} - {}", e.getKind(), alert.getTitle(), e.getMessage());
            writeFallback(alert, "transport failure: " + e.getKind() + ": " + e.getMessage());
        } catch (AlertValidationException e) {
            log.warn("Transport rejected alert payload: {} - {}", alert.getTitle(), e.getMessage());
            writeFallback(alert, "payload rejected: " + e.getMessage());
        }
        return AlertOutcome.FAILED;
    }

    private AlertOutcome reject(Alert alert, AlertOutcome outcome, String reason) {
        log.debug("Alert not sent ({}): {}", outcome, alert.getTitle());
        writeFallback(alert, reason);
        return outcome;
    }

    private void writeFallback(Alert alert, String reason) {
        try {
            fallbackSink.log(alert, reason);
        } catch (RuntimeException e) {
            log.error("Failed to write alert {} to fallback sink: {}", alert.getId(), e.getMessage(), e);
        }
    }
}
