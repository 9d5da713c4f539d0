package com.mltrading.alerting.ratelimit;

import com.mltrading.config.AlertConfig;
import com.mltrading.config.AlertConfigHolder;
import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.model.RateLimitUsage;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-category hourly and daily alert budgets.
 *
 * <p>Each category owns an independent {@link RateLimitWindow}; categories never
 * contend with each other. Limits are read from the current configuration snapshot
 * on every call, so a swapped configuration applies to the next alert.
 *
 * <p>Callers must only ask for budget once an alert has passed severity and
 * category filtering: a successful {@link #allow} consumes budget.
 */
public class AlertRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(AlertRateLimiter.class);

    private final AlertConfigHolder configHolder;
    private final Clock clock;
    private final ConcurrentMap<AlertCategory, RateLimitWindow> windows = new ConcurrentHashMap<>();

    public AlertRateLimiter(AlertConfigHolder configHolder, Clock clock) {
        this.configHolder = configHolder;
        this.clock = clock;
    }

    /**
     * Consumes one unit of the category's budget if both its hour and day windows
     * have room. Always true, without counting, when rate limiting is disabled
     * globally or for this category.
     */
    public boolean allow(AlertCategory category) {
        AlertConfig config = configHolder.current();
        if (isExempt(config, category)) {
            return true;
        }

        AlertConfig.RateLimitSettings limits = config.getRateLimiting();
        Instant now = clock.instant();
        boolean allowed = windowFor(category, now, config)
                .tryAcquire(now, config.getZoneId(), limits.getMaxAlertsPerHour(), limits.getMaxAlertsPerDay());

        if (!allowed) {
            log.debug(
                    "Rate limit reached for {} (max {}/hour, {}/day)",
                    category,
                    limits.getMaxAlertsPerHour(),
                    limits.getMaxAlertsPerDay());
        }
        return allowed;
    }

    public boolean isEnabled() {
        return configHolder.current().getRateLimiting().isEnabled();
    }

    /**
     * Current window usage for every category that is subject to rate limiting.
     */
    public Map<AlertCategory, RateLimitUsage> usage() {
        AlertConfig config = configHolder.current();
        AlertConfig.RateLimitSettings limits = config.getRateLimiting();
        Instant now = clock.instant();

        Map<AlertCategory, RateLimitUsage> usage = new EnumMap<>(AlertCategory.class);
        for (AlertCategory category : AlertCategory.values()) {
            if (!isExempt(config, category)) {
                usage.put(
                        category,
                        windowFor(category, now, config)
                                .usage(now, config.getZoneId(), limits.getMaxAlertsPerHour(), limits.getMaxAlertsPerDay()));
            }
        }
        return Collections.unmodifiableMap(usage);
    }

    private RateLimitWindow windowFor(AlertCategory category, Instant now, AlertConfig config) {
        return windows.computeIfAbsent(category, ignored -> new RateLimitWindow(now, config.getZoneId()));
    }

    private static boolean isExempt(AlertConfig config, AlertCategory category) {
        return !config.getRateLimiting().isEnabled() || !config.category(category).isRateLimited();
    }
}
