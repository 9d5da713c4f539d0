package com.mltrading.alerting.transport;

import com.mltrading.domain.model.Alert;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Renders alerts into plain-text e-mail subject and body.
 *
 * <p>Each category gets a header line with the action an operator is expected to
 * take; the rest of the layout is shared: details block, message, metadata,
 * signature.
 */
public class AlertEmailRenderer {

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public AlertEmailRenderer(Clock clock) {
        this.clock = clock;
    }

    public String renderSubject(Alert alert) {
        return String.format("[%s] MLTrading Alert: %s", alert.getSeverity(), alert.getTitle());
    }

    public String renderBody(Alert alert) {
        StringBuilder body = new StringBuilder();
        body.append(header(alert)).append("\n\n");
        body.append("Alert Details:\n");
        body.append("================\n");
        body.append("Title: ").append(alert.getTitle()).append('\n');
        body.append("Severity: ").append(alert.getSeverity()).append('\n');
        body.append("Category: ").append(alert.getCategory().getKey()).append('\n');
        body.append("Timestamp: ").append(TIME_FORMAT.format(alert.getCreatedAt())).append('\n');
        body.append("Component: ").append(alert.getComponent()).append('\n');
        alert.findCorrelationId()
                .ifPresent(id -> body.append("Correlation ID: ").append(id).append('\n'));
        body.append("Alert ID: ").append(alert.getId()).append('\n');

        body.append("\nMessage:\n--------\n").append(alert.getMessage()).append('\n');

        if (!alert.getMetadata().isEmpty()) {
            body.append("\nAdditional Information:\n----------------------\n");
            for (Map.Entry<String, Object> entry : alert.getMetadata().entrySet()) {
                body.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
            }
        }

        body.append("\n--\nMLTrading Alert System\n");
        body.append("Generated at ").append(TIME_FORMAT.format(clock.instant())).append('\n');
        return body.toString();
    }

    private String header(Alert alert) {
        return switch (alert.getCategory()) {
            case TRADING_ERRORS -> "TRADING ERROR: check open orders and positions at the broker.";
            case SYSTEM_HEALTH -> "SYSTEM HEALTH: a platform component is degraded.";
            case DATA_PIPELINE -> "DATA PIPELINE: scheduled data collection or processing needs attention.";
            case SECURITY -> "SECURITY ALERT: investigate immediately.";
            case GENERAL -> "MLTrading notification.";
        };
    }
}
