package com.mltrading.exception;

import java.util.Map;

/**
 * Raised when an alert cannot be constructed: blank title or message, unknown
 * severity/category, or metadata that cannot be rendered into the outbound payload.
 *
 * <p>This is the only alerting failure that reaches producers. It is thrown before
 * any rate-limit, circuit-breaker or stats state is touched.
 */
public class AlertValidationException extends BaseException {

    public AlertValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public AlertValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
