package com.mltrading.unit.alerting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mltrading.alerting.AlertManager;
import com.mltrading.alerting.PipelineAlertNotifier;
import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.enums.AlertOutcome;
import com.mltrading.domain.enums.AlertSeverity;
import com.mltrading.domain.model.Alert;
import com.mltrading.support.MutableClock;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PipelineAlertNotifierTest {

    @Mock
    private AlertManager alertManager;

    private MutableClock clock;
    private PipelineAlertNotifier notifier;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T06:00:00Z"));
        notifier = new PipelineAlertNotifier(alertManager, clock);
    }

    private Alert capturedAlert() {
        ArgumentCaptor<Alert> captor = ArgumentCaptor.forClass(Alert.class);
        verify(alertManager).process(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Flow Alerts")
    class FlowAlerts {

        @Test
        @DisplayName("Flow start is INFO and carries the run id")
        void flowStart() {
            when(alertManager.process(any())).thenReturn(AlertOutcome.FILTERED_SEVERITY);

            AlertOutcome outcome = notifier.sendFlowStartAlert("daily-collection", "run-42");

            Alert alert = capturedAlert();
            assertThat(outcome).isEqualTo(AlertOutcome.FILTERED_SEVERITY);
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.INFO);
            assertThat(alert.getCategory()).isEqualTo(AlertCategory.DATA_PIPELINE);
            assertThat(alert.getCorrelationId()).isEqualTo("run-42");
        }

        @Test
        @DisplayName("Flow success reports the duration")
        void flowSuccess() {
            notifier.sendFlowSuccessAlert("daily-collection", Duration.ofSeconds(95), null);

            Alert alert = capturedAlert();
            assertThat(alert.getMessage()).contains("95.0s");
            assertThat(alert.getMetadata()).containsEntry("duration_seconds", 95.0);
            assertThat(alert.findCorrelationId()).isEmpty();
        }

        @Test
        @DisplayName("Flow failure is HIGH with error metadata")
        void flowFailure() {
            notifier.sendFlowFailureAlert("daily-collection", new IOException("quota exhausted"), "run-7");

            Alert alert = capturedAlert();
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.HIGH);
            assertThat(alert.getMetadata())
                    .containsEntry("error_type", "IOException")
                    .containsEntry("error_message", "quota exhausted")
                    .containsEntry("flow_name", "daily-collection");
        }

        @Test
        @DisplayName("Task failure is MEDIUM")
        void taskFailure() {
            notifier.sendTaskFailureAlert("fetch_bars", new IllegalStateException("empty payload"), "run-7");

            Alert alert = capturedAlert();
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.MEDIUM);
            assertThat(alert.getTitle()).isEqualTo("Task Failed: fetch_bars");
        }
    }

    @Nested
    @DisplayName("Wrapped Work")
    class WrappedWork {

        @Test
        @DisplayName("Successful work returns its result without an alert")
        void successNoAlert() throws Exception {
            String result = notifier.runWithFailureAlert(
                    "compute_features", AlertSeverity.HIGH, AlertCategory.DATA_PIPELINE, () -> "ok");

            assertThat(result).isEqualTo("ok");
            verify(alertManager, never()).process(any());
        }

        @Test
        @DisplayName("Failing work raises an alert and rethrows the original exception")
        void failureAlertsAndRethrows() {
            IOException failure = new IOException("connection reset");

            assertThatThrownBy(() -> notifier.runWithFailureAlert(
                            "compute_features", AlertSeverity.CRITICAL, AlertCategory.TRADING_ERRORS, () -> {
                                throw failure;
                            }))
                    .isSameAs(failure);

            Alert alert = capturedAlert();
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
            assertThat(alert.getCategory()).isEqualTo(AlertCategory.TRADING_ERRORS);
            assertThat(alert.getMetadata()).containsEntry("function", "compute_features");
        }

        @Test
        @DisplayName("Work slower than the threshold raises a runtime alert")
        void slowWorkAlerts() throws Exception {
            Integer result = notifier.runWithRuntimeAlert("train_model", Duration.ofMinutes(10), () -> {
                clock.advance(Duration.ofMinutes(12));
                return 7;
            });

            assertThat(result).isEqualTo(7);
            Alert alert = capturedAlert();
            assertThat(alert.getCategory()).isEqualTo(AlertCategory.SYSTEM_HEALTH);
            assertThat(alert.getMetadata())
                    .containsEntry("runtime_seconds", 720.0)
                    .containsEntry("failed", false);
        }

        @Test
        @DisplayName("Work within the threshold raises nothing")
        void fastWorkQuiet() throws Exception {
            notifier.runWithRuntimeAlert("train_model", Duration.ofMinutes(10), () -> {
                clock.advance(Duration.ofMinutes(2));
                return null;
            });

            verify(alertManager, never()).process(any());
        }

        @Test
        @DisplayName("Slow failing work still raises the runtime alert")
        void slowFailingWork() {
            assertThatThrownBy(() -> notifier.runWithRuntimeAlert("train_model", Duration.ofSeconds(1), () -> {
                        clock.advance(Duration.ofSeconds(5));
                        throw new IllegalStateException("out of memory");
                    }))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(capturedAlert().getMetadata()).containsEntry("failed", true);
        }
    }
}
