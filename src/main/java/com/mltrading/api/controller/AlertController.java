package com.mltrading.api.controller;

import com.mltrading.alerting.AlertManager;
import com.mltrading.api.dto.request.SendAlertRequest;
import com.mltrading.api.dto.response.SendAlertResponse;
import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.enums.AlertOutcome;
import com.mltrading.domain.enums.AlertSeverity;
import com.mltrading.domain.model.Alert;
import com.mltrading.domain.model.AlertStats;
import com.mltrading.domain.model.AlertSystemStatus;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator API for the alerting system.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/alerts} -- raise an alert through the full pipeline</li>
 *   <li>{@code GET /api/alerts/status} -- enablement, breaker state, rate-limit usage</li>
 *   <li>{@code GET /api/alerts/stats} -- counters since start or last reset</li>
 *   <li>{@code POST /api/alerts/test} -- send a synthetic INFO alert</li>
 *   <li>{@code POST /api/alerts/stats/reset} -- zero the counters</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/alerts")
public class AlertController {

    private final AlertManager alertManager;

    public AlertController(AlertManager alertManager) {
        this.alertManager = alertManager;
    }

    @PostMapping
    public SendAlertResponse sendAlert(@Valid @RequestBody SendAlertRequest request) {
        Alert alert = Alert.builder()
                .title(request.getTitle())
                .message(request.getMessage())
                .severity(AlertSeverity.fromString(request.getSeverity()))
                .category(request.getCategory() != null ? AlertCategory.fromKey(request.getCategory()) : null)
                .component(request.getComponent())
                .metadata(request.getMetadata())
                .build();

        AlertOutcome outcome = alertManager.process(alert);
        return SendAlertResponse.builder()
                .alertId(alert.getId())
                .outcome(outcome)
                .delivered(outcome.isDelivered())
                .build();
    }

    @GetMapping("/status")
    public AlertSystemStatus getStatus() {
        return alertManager.getStatus();
    }

    @GetMapping("/stats")
    public AlertStats getStats() {
        return alertManager.getStats();
    }

    @PostMapping("/test")
    public Map<String, Object> testAlertSystem() {
        boolean delivered = alertManager.testAlertSystem();
        return Map.of(
                "delivered",
                delivered,
                "message",
                delivered ? "Test alert sent" : "Test alert was not delivered; see status and fallback log");
    }

    @PostMapping("/stats/reset")
    public Map<String, String> resetStats() {
        alertManager.resetStats();
        return Map.of("message", "Alert statistics reset");
    }
}
