package com.mltrading.domain.model;

import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.enums.AlertSeverity;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time copy of the alerting counters. Value-equal snapshots taken with
 * no alert processed in between are equal.
 *
 * <p>{@code filtered} includes severity filtering, category disablement and
 * alerts dropped while the system is globally disabled.
 */
@Value
@Builder
public class AlertStats {

    long total;
    long sent;
    long failed;
    long rateLimited;
    long filtered;
    Map<AlertCategory, Long> byCategory;
    Map<AlertSeverity, Long> bySeverity;

    public long countFor(AlertCategory category) {
        return byCategory.getOrDefault(category, 0L);
    }

    public long countFor(AlertSeverity severity) {
        return bySeverity.getOrDefault(severity, 0L);
    }
}
