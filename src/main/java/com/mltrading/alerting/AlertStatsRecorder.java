package com.mltrading.alerting;

import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.enums.AlertOutcome;
import com.mltrading.domain.enums.AlertSeverity;
import com.mltrading.domain.model.Alert;
import com.mltrading.domain.model.AlertStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Aggregate alert counters.
 *
 * <p>Counters only grow during normal operation; {@link #reset()} is an explicit
 * operator action. Every outcome is also mirrored into Micrometer as
 * {@code alerts.processed{outcome, category}} so dashboards see suppressed and failed
 * volume without producers checking return values.
 *
 * <p>Counters are {@link LongAdder}s. A snapshot taken concurrently with
 * {@link #recordOutcome} may see the total incremented before the outcome counter.
 */
public class AlertStatsRecorder {

    private final MeterRegistry meterRegistry;

    private final LongAdder total = new LongAdder();
    private final LongAdder sent = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder rateLimited = new LongAdder();
    private final LongAdder filtered = new LongAdder();
    private final Map<AlertCategory, LongAdder> byCategory = new EnumMap<>(AlertCategory.class);
    private final Map<AlertSeverity, LongAdder> bySeverity = new EnumMap<>(AlertSeverity.class);

    public AlertStatsRecorder(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (AlertCategory category : AlertCategory.values()) {
            byCategory.put(category, new LongAdder());
        }
        for (AlertSeverity severity : AlertSeverity.values()) {
            bySeverity.put(severity, new LongAdder());
        }
    }

    /** Counts an alert entering the pipeline, before any filter runs. */
    public void recordReceived(Alert alert) {
        total.increment();
        byCategory.get(alert.getCategory()).increment();
        bySeverity.get(alert.getSeverity()).increment();
    }

    public void recordOutcome(Alert alert, AlertOutcome outcome) {
        switch (outcome) {
            case SENT -> sent.increment();
            case FAILED -> failed.increment();
            case RATE_LIMITED -> rateLimited.increment();
            case FILTERED_SEVERITY, FILTERED_CATEGORY, DISABLED -> filtered.increment();
        }
        Counter.builder("alerts.processed")
                .description("Alerts processed by the alerting pipeline, by outcome")
                .tag("outcome", outcome.name())
                .tag("category", alert.getCategory().getKey())
                .register(meterRegistry)
                .increment();
    }

    public AlertStats snapshot() {
        Map<AlertCategory, Long> categories = new EnumMap<>(AlertCategory.class);
        byCategory.forEach((category, count) -> categories.put(category, count.sum()));
        Map<AlertSeverity, Long> severities = new EnumMap<>(AlertSeverity.class);
        bySeverity.forEach((severity, count) -> severities.put(severity, count.sum()));

        return AlertStats.builder()
                .total(total.sum())
                .sent(sent.sum())
                .failed(failed.sum())
                .rateLimited(rateLimited.sum())
                .filtered(filtered.sum())
                .byCategory(Collections.unmodifiableMap(categories))
                .bySeverity(Collections.unmodifiableMap(severities))
                .build();
    }

    /** Zeroes the in-memory counters. Micrometer counters are cumulative and are not touched. */
    public void reset() {
        total.reset();
        sent.reset();
        failed.reset();
        rateLimited.reset();
        filtered.reset();
        byCategory.values().forEach(LongAdder::reset);
        bySeverity.values().forEach(LongAdder::reset);
    }
}
