package com.mltrading.domain.model;

import com.mltrading.domain.enums.AlertCategory;
import com.mltrading.domain.enums.AlertSeverity;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable alert raised by a producer (pipeline, scheduler, API handler) or built
 * by {@link com.mltrading.alerting.AlertFactory}.
 *
 * <p>The builder validates: title and message must be non-blank, severity and
 * category are required, and metadata must be representable in the outbound
 * payload (see {@link AlertValidator}). Invalid input throws
 * {@link com.mltrading.exception.AlertValidationException} from {@code build()}.
 *
 * <p>Defaults: a random UUID id, {@code createdAt = now}, component {@code "unknown"},
 * category {@link AlertCategory#GENERAL}, empty metadata.
 */
@Value
public class Alert {

    public static final String UNKNOWN_COMPONENT = "unknown";

    String id;
    String title;
    String message;
    AlertSeverity severity;
    AlertCategory category;
    String component;
    Map<String, Object> metadata;
    Instant createdAt;
    String correlationId;

    @Builder(toBuilder = true)
    private Alert(
            String id,
            String title,
            String message,
            AlertSeverity severity,
            AlertCategory category,
            String component,
            Map<String, ?> metadata,
            Instant createdAt,
            String correlationId) {
        this.title = AlertValidator.requireText(title, "title");
        this.message = AlertValidator.requireText(message, "message");
        this.severity = AlertValidator.requirePresent(severity, "severity");
        this.category = category != null ? category : AlertCategory.GENERAL;
        this.metadata = AlertValidator.copyMetadata(metadata);
        this.id = id != null && !id.isBlank() ? id : UUID.randomUUID().toString();
        this.component = component != null && !component.isBlank() ? component : UNKNOWN_COMPONENT;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.correlationId = correlationId != null && !correlationId.isBlank() ? correlationId : null;
    }

    public Optional<String> findCorrelationId() {
        return Optional.ofNullable(correlationId);
    }

    /** A CRITICAL security alert bypasses the per-category enable flag. */
    public boolean isForcedSecurityAlert() {
        return severity == AlertSeverity.CRITICAL && category == AlertCategory.SECURITY;
    }
}
