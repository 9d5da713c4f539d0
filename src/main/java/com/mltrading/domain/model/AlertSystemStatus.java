package com.mltrading.domain.model;

import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.enums.AlertSeverity;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Operator view of the alerting system.
 *
 * <p>{@code transportAvailable} reflects only the circuit breaker (false while it is
 * OPEN). {@code transportConfigured} reports whether the transport itself is
 * enabled and has credentials and a recipient.
 */
@Value
@Builder
public class AlertSystemStatus {

    boolean enabled;
    boolean transportAvailable;
    boolean transportConfigured;
    boolean rateLimitingEnabled;
    AlertSeverity minSeverity;
    CircuitBreakerSnapshot circuitBreaker;
    Map<AlertCategory, Boolean> categoriesEnabled;
    Map<AlertCategory, RateLimitUsage> rateLimits;
}
