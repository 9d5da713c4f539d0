package com.mltrading.alerting.fallback;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mltrading.domain.model.Alert;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends undelivered alerts to a local JSON-lines file, one object per line.
 *
 * <p>Depends on nothing but the local file system, so it keeps working while the
 * SMTP transport is down. Each record is also logged at WARN. Appends are
 * serialized on this instance so concurrent writers never interleave lines.
 */
public class FileFallbackSink implements FallbackSink {

    private static final Logger log = LoggerFactory.getLogger(FileFallbackSink.class);

    private final Path path;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public FileFallbackSink(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void log(Alert alert, String reason) {
        log.warn(
                "Alert not delivered [{}] {} - {} ({}): {}",
                alert.getCategory(),
                alert.getSeverity(),
                alert.getTitle(),
                alert.getComponent(),
                reason);

        String line = toJsonLine(alert, reason);
        synchronized (this) {
            try {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null && Files.notExists(parent)) {
                    Files.createDirectories(parent);
                }
                Files.writeString(
                        path,
                        line,
                        StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE,
                        StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append alert " + alert.getId() + " to " + path, e);
            }
        }
    }

    public Path getPath() {
        return path;
    }

    private String toJsonLine(Alert alert, String reason) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("recorded_at", clock.instant());
        record.put("reason", reason);
        record.put("id", alert.getId());
        record.put("created_at", alert.getCreatedAt());
        record.put("severity", alert.getSeverity());
        record.put("category", alert.getCategory().getKey());
        record.put("component", alert.getComponent());
        record.put("title", alert.getTitle());
        record.put("message", alert.getMessage());
        record.put("correlation_id", alert.getCorrelationId());
        record.put("metadata", alert.getMetadata());
        try {
            return objectMapper.writeValueAsString(record) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize alert " + alert.getId(), e);
        }
    }
}
