package com.mltrading.domain.model;

import com.mltrading.domain.enums.CircuitState;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CircuitBreakerSnapshot {

    String name;
    CircuitState state;
    int consecutiveFailures;
    int failureThreshold;
    long recoveryTimeoutMillis;

    /** Null until the first transport failure. */
    Instant lastFailureAt;

    /** Null while the breaker has never opened. */
    Instant openedAt;
}
