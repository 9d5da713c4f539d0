package com.mltrading.unit.alerting;

import static org.assertj.core.api.Assertions.assertThat;

import com.mltrading.alerting.AlertStatsRecorder;
import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.enums.AlertOutcome;
import com.mltrading.domain.enums.AlertSeverity;
import com.mltrading.domain.model.Alert;
import com.mltrading.domain.model.AlertStats;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AlertStatsRecorderTest {

    private SimpleMeterRegistry meterRegistry;
    private AlertStatsRecorder recorder;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        recorder = new AlertStatsRecorder(meterRegistry);
    }

    private Alert alert(AlertSeverity severity, AlertCategory category) {
        return Alert.builder()
                .title("t")
                .message("m")
                .severity(severity)
                .category(category)
                .build();
    }

    private void record(Alert alert, AlertOutcome outcome) {
        recorder.recordReceived(alert);
        recorder.recordOutcome(alert, outcome);
    }

    @Test
    @DisplayName("Counts totals, outcomes, categories and severities")
    void countsEverything() {
        record(alert(AlertSeverity.HIGH, AlertCategory.TRADING_ERRORS), AlertOutcome.SENT);
        record(alert(AlertSeverity.LOW, AlertCategory.GENERAL), AlertOutcome.FILTERED_SEVERITY);
        record(alert(AlertSeverity.HIGH, AlertCategory.DATA_PIPELINE), AlertOutcome.FILTERED_CATEGORY);
        record(alert(AlertSeverity.CRITICAL, AlertCategory.SECURITY), AlertOutcome.DISABLED);
        record(alert(AlertSeverity.HIGH, AlertCategory.TRADING_ERRORS), AlertOutcome.RATE_LIMITED);
        record(alert(AlertSeverity.MEDIUM, AlertCategory.SYSTEM_HEALTH), AlertOutcome.FAILED);

        AlertStats stats = recorder.snapshot();

        assertThat(stats.getTotal()).isEqualTo(6);
        assertThat(stats.getSent()).isEqualTo(1);
        assertThat(stats.getFiltered()).isEqualTo(3);
        assertThat(stats.getRateLimited()).isEqualTo(1);
        assertThat(stats.getFailed()).isEqualTo(1);
        assertThat(stats.countFor(AlertCategory.TRADING_ERRORS)).isEqualTo(2);
        assertThat(stats.countFor(AlertSeverity.HIGH)).isEqualTo(3);
        assertThat(stats.countFor(AlertSeverity.INFO)).isZero();
    }

    @Test
    @DisplayName("Mirrors outcomes into the alerts.processed counter")
    void mirrorsIntoMicrometer() {
        Alert alert = alert(AlertSeverity.HIGH, AlertCategory.TRADING_ERRORS);
        record(alert, AlertOutcome.SENT);
        record(alert, AlertOutcome.SENT);

        double count = meterRegistry
                .get("alerts.processed")
                .tag("outcome", "SENT")
                .tag("category", "trading_errors")
                .counter()
                .count();

        assertThat(count).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Snapshots are values and reset zeroes every counter")
    void snapshotAndReset() {
        record(alert(AlertSeverity.HIGH, AlertCategory.GENERAL), AlertOutcome.SENT);

        assertThat(recorder.snapshot()).isEqualTo(recorder.snapshot());

        recorder.reset();

        AlertStats stats = recorder.snapshot();
        assertThat(stats.getTotal()).isZero();
        assertThat(stats.getSent()).isZero();
        assertThat(stats.countFor(AlertCategory.GENERAL)).isZero();
    }
}
