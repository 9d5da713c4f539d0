package com.mltrading.unit.alerting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mltrading.alerting.AlertFactory;
import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.enums.AlertSeverity;
import com.mltrading.domain.model.Alert;
import com.mltrading.exception.AlertValidationException;
import com.mltrading.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class AlertFactoryTest {

    @Nested
    @DisplayName("Order Failure")
    class OrderFailure {

        @Test
        @DisplayName("Builds HIGH trading error with symbol and order type metadata")
        void buildsOrderFailure() {
            Alert alert = AlertFactory.createOrderFailureAlert(
                    "AAPL", "LIMIT", "insufficient buying power", Map.of("account", "paper"));

            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.HIGH);
            assertThat(alert.getCategory()).isEqualTo(AlertCategory.TRADING_ERRORS);
            assertThat(alert.getComponent()).isEqualTo(AlertFactory.DEFAULT_TRADING_COMPONENT);
            assertThat(alert.getTitle()).contains("AAPL").contains("LIMIT");
            assertThat(alert.getMessage()).contains("insufficient buying power");
            assertThat(alert.getMetadata())
                    .containsEntry("symbol", "AAPL")
                    .containsEntry("order_type", "LIMIT")
                    .containsEntry("account", "paper");
        }

        @Test
        @DisplayName("Rejects a blank symbol")
        void rejectsBlankSymbol() {
            assertThatThrownBy(() -> AlertFactory.createOrderFailureAlert("", "MARKET", "error", null))
                    .isInstanceOf(AlertValidationException.class)
                    .hasMessageContaining("symbol");
        }
    }

    @Nested
    @DisplayName("Performance")
    class Performance {

        @ParameterizedTest(name = "{0} against threshold 100 is {1}")
        @CsvSource({
            "50, LOW",
            "100, LOW",
            "120, MEDIUM",
            "149.9, MEDIUM",
            "150, HIGH",
            "199.9, HIGH",
            "200, CRITICAL",
            "450, CRITICAL"
        })
        void severityScalesWithBreach(double currentValue, AlertSeverity expected) {
            Alert alert = AlertFactory.createPerformanceAlert("latency_ms", currentValue, 100, "Gateway");

            assertThat(alert.getSeverity()).isEqualTo(expected);
            assertThat(alert.getCategory()).isEqualTo(AlertCategory.SYSTEM_HEALTH);
        }

        @Test
        @DisplayName("Carries metric, value and threshold in metadata")
        void metadata() {
            Alert alert = AlertFactory.createPerformanceAlert("cpu_percent", 95.0, 80.0, "Host");

            assertThat(alert.getMetadata())
                    .containsEntry("metric", "cpu_percent")
                    .containsEntry("current_value", 95.0)
                    .containsEntry("threshold", 80.0);
            assertThat(alert.getMessage()).contains("exceeded");
        }

        @ParameterizedTest
        @ValueSource(doubles = {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY})
        void rejectsInvalidThreshold(double threshold) {
            assertThatThrownBy(() -> AlertFactory.createPerformanceAlert("cpu", 10, threshold, "Host"))
                    .isInstanceOf(AlertValidationException.class);
        }

        @Test
        @DisplayName("Rejects a non-finite current value")
        void rejectsNonFiniteValue() {
            assertThatThrownBy(() -> AlertFactory.createPerformanceAlert("cpu", Double.NaN, 80, "Host"))
                    .isInstanceOf(AlertValidationException.class);
        }
    }

    @Nested
    @DisplayName("Security")
    class Security {

        @Test
        @DisplayName("Always CRITICAL / SECURITY with a prefixed title")
        void alwaysCriticalSecurity() {
            Alert alert = AlertFactory.createSecurityAlert("API key used from new IP", "203.0.113.9", "Gateway");

            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
            assertThat(alert.getCategory()).isEqualTo(AlertCategory.SECURITY);
            assertThat(alert.getTitle()).isEqualTo("Security Alert: API key used from new IP");
            assertThat(alert.isForcedSecurityAlert()).isTrue();
        }

        @Test
        @DisplayName("Rejects a blank message")
        void rejectsBlankMessage() {
            assertThatThrownBy(() -> AlertFactory.createSecurityAlert("Title", "  ", "Gateway"))
                    .isInstanceOf(AlertValidationException.class);
        }
    }

    @Nested
    @DisplayName("Other Builders")
    class OtherBuilders {

        @Test
        @DisplayName("Trading error title combines error type and component")
        void tradingError() {
            Alert alert = AlertFactory.createTradingErrorAlert("Position mismatch", "Reconciler", null);

            assertThat(alert.getTitle()).isEqualTo("Trading Error in Reconciler");
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.HIGH);
        }

        @Test
        @DisplayName("Startup alert is INFO and includes the version")
        void startup() {
            Alert alert = AlertFactory.createSystemStartupAlert("Scheduler", "1.4.0", null);

            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.INFO);
            assertThat(alert.getTitle()).isEqualTo("System Started: Scheduler (v1.4.0)");
        }

        @Test
        @DisplayName("Shutdown alert is MEDIUM with a default reason")
        void shutdown() {
            Alert alert = AlertFactory.createSystemShutdownAlert("Scheduler", null, null);

            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.MEDIUM);
            assertThat(alert.getMessage()).contains("Normal shutdown");
        }

        @Test
        @DisplayName("Data pipeline error is MEDIUM / DATA_PIPELINE")
        void dataPipelineError() {
            Alert alert = AlertFactory.createDataPipelineErrorAlert(
                    "daily_bars", "Upstream returned 503", "Collector", null);

            assertThat(alert.getCategory()).isEqualTo(AlertCategory.DATA_PIPELINE);
            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.MEDIUM);
            assertThat(alert.getTitle()).isEqualTo("Data Pipeline Error: daily_bars");
        }

        @Test
        @DisplayName("Circuit breaker alert is HIGH / SYSTEM_HEALTH")
        void circuitBreaker() {
            Alert alert = AlertFactory.createCircuitBreakerAlert("market-data-api", "Collector", null);

            assertThat(alert.getSeverity()).isEqualTo(AlertSeverity.HIGH);
            assertThat(alert.getCategory()).isEqualTo(AlertCategory.SYSTEM_HEALTH);
        }

        @Test
        @DisplayName("Data freshness alert reports the data age")
        void dataFreshness() {
            MutableClock clock = new MutableClock(Instant.parse("2026-03-02T12:00:00Z"));

            Alert alert = AlertFactory.createDataFreshnessAlert(
                    "minute_bars",
                    Instant.parse("2026-03-02T06:30:00Z"),
                    Duration.ofHours(2),
                    null,
                    null,
                    clock);

            assertThat(alert.getComponent()).isEqualTo("DataMonitor");
            assertThat(alert.getMetadata())
                    .containsEntry("data_source", "minute_bars")
                    .containsEntry("hours_old", 5.5)
                    .containsEntry("threshold_hours", 2L);
            assertThat(alert.getMessage()).contains("5.5 hours old");
        }

        @Test
        @DisplayName("Rejects metadata that cannot be rendered")
        void rejectsUnrepresentableMetadata() {
            assertThatThrownBy(() -> AlertFactory.createApiErrorAlert(
                            "quotes", "timeout", "Api", Map.of("handle", new Object())))
                    .isInstanceOf(AlertValidationException.class)
                    .hasMessageContaining("metadata.handle");
        }
    }
}
