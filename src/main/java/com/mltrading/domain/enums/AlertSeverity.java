package com.mltrading.domain.enums;

import com.mltrading.exception.AlertValidationException;
import java.util.Locale;

/**
 * Urgency tier of an alert.
 *
 * <p>Declaration order is the severity order: INFO &lt; LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL.
 * The minimum-severity filter compares ordinals, so new levels must be inserted
 * at the position matching their urgency.
 */
public enum AlertSeverity {

    /** Informational, no action required. */
    INFO,

    LOW,

    MEDIUM,

    /** Requires trader attention soon. */
    HIGH,

    /** Requires immediate attention. Security alerts are always CRITICAL. */
    CRITICAL;

    public boolean isAtLeast(AlertSeverity other) {
        return compareTo(other) >= 0;
    }

    public boolean isBelow(AlertSeverity other) {
        return compareTo(other) < 0;
    }

    /**
     * Case-insensitive lookup used for configuration values and API payloads.
     *
     * @throws AlertValidationException if the value names no severity
     */
    public static AlertSeverity fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new AlertValidationException("Alert severity must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new AlertValidationException("Unknown alert severity: " + value);
        }
    }
}
