package com.mltrading.config;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the current {@link AlertConfig} snapshot. Readers take one snapshot per
 * operation; {@link #swap(AlertConfig)} replaces the reference atomically.
 */
public class AlertConfigHolder {

    private static final Logger log = LoggerFactory.getLogger(AlertConfigHolder.class);

    private final AtomicReference<AlertConfig> current;

    public AlertConfigHolder(AlertConfig initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial config"));
    }

    public AlertConfig current() {
        return current.get();
    }

    /**
     * Installs a new snapshot. Calls already in progress finish with the snapshot
     * they read.
     *
     * @return the snapshot that was replaced
     */
    public AlertConfig swap(AlertConfig next) {
        AlertConfig previous = current.getAndSet(Objects.requireNonNull(next, "next config"));
        log.info(
                "Alert configuration replaced: enabled={} minSeverity={} rateLimiting={}",
                next.isEnabled(),
                next.getMinSeverity(),
                next.getRateLimiting().isEnabled());
        return previous;
    }
}
