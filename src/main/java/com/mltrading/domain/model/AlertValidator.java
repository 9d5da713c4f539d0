package com.mltrading.domain.model;

import com.mltrading.exception.AlertValidationException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Checks alert fields before an {@link Alert} is created.
 *
 * <p>Metadata ends up in two places: the plain-text e-mail body and the JSON
 * fallback record. Only values both can render are accepted: strings, finite
 * numbers, booleans, characters, enums, temporals, UUIDs, and maps/collections of
 * those. The accepted metadata is deep-copied into unmodifiable, insertion-ordered
 * structures so the alert stays immutable even if the caller keeps mutating its map.
 */
public final class AlertValidator {

    static final int MAX_METADATA_DEPTH = 8;

    private AlertValidator() {}

    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new AlertValidationException("Alert " + field + " cannot be empty", Map.of("field", field));
        }
        return value;
    }

    public static <T> T requirePresent(T value, String field) {
        if (value == null) {
            throw new AlertValidationException("Alert " + field + " is required", Map.of("field", field));
        }
        return value;
    }

    /**
     * Validates and deep-copies alert metadata.
     *
     * @return an unmodifiable, insertion-ordered copy; empty for {@code null}
     * @throws AlertValidationException naming the offending key path
     */
    public static Map<String, Object> copyMetadata(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        return copyMap(metadata, "metadata", 1);
    }

    private static Map<String, Object> copyMap(Map<?, ?> source, String path, int depth) {
        checkDepth(path, depth);
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (!(entry.getKey() instanceof String key) || key.isBlank()) {
                throw invalid(path, "metadata keys must be non-blank strings, got " + entry.getKey());
            }
            copy.put(key, copyValue(entry.getValue(), path + "." + key, depth));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value, String path, int depth) {
        if (value == null
                || value instanceof String
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Enum<?>
                || value instanceof TemporalAccessor
                || value instanceof UUID) {
            return value;
        }
        if (value instanceof Number number) {
            if ((value instanceof Double || value instanceof Float) && !Double.isFinite(number.doubleValue())) {
                throw invalid(path, "non-finite number " + value);
            }
            return value;
        }
        if (value instanceof Map<?, ?> nested) {
            return copyMap(nested, path, depth + 1);
        }
        if (value instanceof Collection<?> items) {
            checkDepth(path, depth + 1);
            List<Object> copy = new ArrayList<>(items.size());
            int index = 0;
            for (Object item : items) {
                copy.add(copyValue(item, path + "[" + index++ + "]", depth + 1));
            }
            return Collections.unmodifiableList(copy);
        }
        throw invalid(path, "unsupported value type " + value.getClass().getName());
    }

    private static void checkDepth(String path, int depth) {
        if (depth > MAX_METADATA_DEPTH) {
            throw invalid(path, "nested deeper than " + MAX_METADATA_DEPTH + " levels");
        }
    }

    private static AlertValidationException invalid(String path, String reason) {
        return new AlertValidationException(
                "Alert metadata is not representable at '" + path + "': " + reason, Map.of("path", path));
    }
}
