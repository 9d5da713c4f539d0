package com.mltrading.domain.enums;

import com.mltrading.exception.AlertValidationException;
import java.util.Arrays;
import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Functional area an alert originates from. Each category has its own
 * enable flag, default severity and rate-limit budget.
 *
 * <p>The {@code key} is the lower-snake-case name used in metrics tags and the
 * fallback log. Configuration uses the dashed form
 * ({@code mltrading.alerts.categories.trading-errors.enabled}) because property
 * binding drops underscores from map keys.
 */
@Getter
@RequiredArgsConstructor
public enum AlertCategory {
    TRADING_ERRORS("trading_errors"),
    SYSTEM_HEALTH("system_health"),
    DATA_PIPELINE("data_pipeline"),
    SECURITY("security"),
    GENERAL("general");

    private final String key;

    /**
     * Resolves a category from either its config key ({@code data_pipeline}) or
     * its enum name ({@code DATA_PIPELINE}), ignoring case and dashes.
     *
     * @throws AlertValidationException if the value names no category
     */
    public static AlertCategory fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new AlertValidationException("Alert category must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(category -> category.key.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new AlertValidationException("Unknown alert category: " + value));
    }
}
