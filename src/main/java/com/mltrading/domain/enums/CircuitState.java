package com.mltrading.domain.enums;

/**
 * State of the circuit breaker guarding the outbound e-mail transport.
 * CLOSED passes calls through, OPEN fails fast without calling the transport,
 * HALF_OPEN lets exactly one trial call through.
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
