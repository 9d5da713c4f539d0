package com.mltrading.domain.enums;

/**
 * Result of pushing one alert through the alerting pipeline.
 *
 * <p>Only {@link #SENT} means the transport accepted the alert. The filter and
 * rate-limit outcomes are policy decisions, not errors; {@link #FAILED} covers
 * transport errors and fast-fails from an open circuit breaker. Every outcome
 * other than SENT is written to the fallback sink.
 */
public enum AlertOutcome {
    SENT,
    FILTERED_SEVERITY,
    FILTERED_CATEGORY,
    RATE_LIMITED,
    FAILED,

    /** The alerting system is switched off globally. */
    DISABLED;

    public boolean isDelivered() {
        return this == SENT;
    }

    public boolean isFiltered() {
        return this == FILTERED_SEVERITY || this == FILTERED_CATEGORY || this == DISABLED;
    }
}
