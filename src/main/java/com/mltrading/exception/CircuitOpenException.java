package com.mltrading.exception;

import java.time.Duration;
import lombok.Getter;

/**
 * Fast-fail raised instead of calling the transport while the circuit breaker is
 * OPEN, or while its single HALF_OPEN trial call is already in flight.
 */
@Getter
public class CircuitOpenException extends BaseException {

    private final String breakerName;
    private final Duration retryAfter;

    public CircuitOpenException(String breakerName, Duration retryAfter, Throwable cause) {
        super(
                ErrorCode.TRANSPORT_UNAVAILABLE,
                "Circuit breaker '" + breakerName + "' is open; transport call not attempted",
                cause);
        this.breakerName = breakerName;
        this.retryAfter = retryAfter;
    }
}
