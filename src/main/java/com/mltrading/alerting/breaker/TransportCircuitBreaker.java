package com.mltrading.alerting.breaker;

import com.mltrading.config.AlertConfig;
import com.mltrading.domain.enums.CircuitState;
import com.mltrading.domain.enums.TransportFailureKind;
import com.mltrading.domain.model.CircuitBreakerSnapshot;
import com.mltrading.exception.AlertValidationException;
import com.mltrading.exception.CircuitOpenException;
import com.mltrading.exception.TransportException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Circuit breaker guarding the outbound alert transport.
 *
 * <p>Backed by a Resilience4j {@link CircuitBreaker} configured so that its
 * failure-rate rule reads as a consecutive-failure rule:
 * <ul>
 *   <li>count-based sliding window of {@code failureThreshold} calls, 100% failure
 *       rate threshold: the breaker opens once the last {@code failureThreshold}
 *       calls all failed, i.e. after that many consecutive failures</li>
 *   <li>one permitted call in HALF_OPEN: success closes, failure reopens and
 *       restarts the recovery timer</li>
 *   <li>no automatic OPEN to HALF_OPEN transition: the first call after
 *       {@code recoveryTimeout} becomes the trial call</li>
 *   <li>only {@link TransportException} is recorded as a failure;
 *       {@link AlertValidationException} is ignored entirely</li>
 *   <li>slow successful calls never count: the slow-call threshold is a day</li>
 * </ul>
 *
 * <p>Resilience4j's state machine transitions atomically and runs the wrapped call
 * outside of any lock, so a hung send never blocks state evaluation for other callers.
 */
public class TransportCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(TransportCircuitBreaker.class);

    /** Far above any bounded SMTP exchange, so a slow successful send is never a failure. */
    private static final Duration SLOW_CALL_DURATION = Duration.ofDays(1);

    private final CircuitBreaker circuitBreaker;
    private final Clock clock;
    private final int failureThreshold;
    private final Duration recoveryTimeout;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicReference<Instant> lastFailureAt = new AtomicReference<>();
    private final AtomicReference<Instant> openedAt = new AtomicReference<>();

    public TransportCircuitBreaker(
            String name, AlertConfig.CircuitBreakerSettings settings, CircuitBreakerRegistry registry, Clock clock) {
        this.clock = clock;
        this.failureThreshold = settings.getFailureThreshold();
        this.recoveryTimeout = settings.getRecoveryTimeout();
        this.circuitBreaker = registry.circuitBreaker(name, buildConfig(settings));
        registerListeners();
    }

    static CircuitBreakerConfig buildConfig(AlertConfig.CircuitBreakerSettings settings) {
        if (settings.getFailureThreshold() < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1");
        }
        return CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.getFailureThreshold())
                .minimumNumberOfCalls(settings.getFailureThreshold())
                .failureRateThreshold(100.0f)
                .slowCallRateThreshold(100.0f)
                .slowCallDurationThreshold(SLOW_CALL_DURATION)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(settings.getRecoveryTimeout())
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .recordExceptions(TransportException.class)
                .ignoreExceptions(AlertValidationException.class)
                .writableStackTraceEnabled(false)
                .build();
    }

    /**
     * Runs the transport call through the breaker.
     *
     * @throws CircuitOpenException if the breaker is OPEN (or its HALF_OPEN trial is
     *     taken); the call is not made
     * @throws TransportException if the call failed at transport level; unexpected
     *     runtime errors from the call are wrapped into one so they count as failures
     * @throws AlertValidationException if the transport rejected the payload itself;
     *     not counted
     */
    public void call(Runnable transportCall) {
        try {
            circuitBreaker.executeRunnable(() -> runRecordingUnexpected(transportCall));
        } catch (CallNotPermittedException e) {
            throw new CircuitOpenException(circuitBreaker.getName(), retryAfter(), e);
        }
    }

    public CircuitState getState() {
        return switch (circuitBreaker.getState()) {
            case OPEN, FORCED_OPEN -> CircuitState.OPEN;
            case HALF_OPEN -> CircuitState.HALF_OPEN;
            default -> CircuitState.CLOSED;
        };
    }

    public boolean isOpen() {
        return getState() == CircuitState.OPEN;
    }

    public CircuitBreakerSnapshot snapshot() {
        return CircuitBreakerSnapshot.builder()
                .name(circuitBreaker.getName())
                .state(getState())
                .consecutiveFailures(consecutiveFailures.get())
                .failureThreshold(failureThreshold)
                .recoveryTimeoutMillis(recoveryTimeout.toMillis())
                .lastFailureAt(lastFailureAt.get())
                .openedAt(openedAt.get())
                .build();
    }

    /** Operator reset: back to CLOSED with cleared failure history. */
    public void reset() {
        circuitBreaker.reset();
        consecutiveFailures.set(0);
        log.info("Circuit breaker '{}' manually reset", circuitBreaker.getName());
    }

    private static void runRecordingUnexpected(Runnable transportCall) {
        try {
            transportCall.run();
        } catch (TransportException | AlertValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransportException(
                    TransportFailureKind.PROTOCOL, "Unexpected transport failure: " + e.getMessage(), e);
        }
    }

    private Duration retryAfter() {
        Instant opened = openedAt.get();
        if (opened == null) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), opened.plus(recoveryTimeout));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private void registerListeners() {
        circuitBreaker
                .getEventPublisher()
                .onError(event -> {
                    lastFailureAt.set(clock.instant());
                    int failures = consecutiveFailures.incrementAndGet();
                    log.warn(
                            "Transport failure {}/{} on '{}': {}",
                            failures,
                            failureThreshold,
                            circuitBreaker.getName(),
                            event.getThrowable().getMessage());
                })
                .onSuccess(event -> consecutiveFailures.set(0))
                .onStateTransition(event -> {
                    CircuitBreaker.State toState = event.getStateTransition().getToState();
                    if (toState == CircuitBreaker.State.OPEN) {
                        openedAt.set(clock.instant());
                        log.warn(
                                "Circuit breaker '{}' OPEN after {} consecutive failures; retry in {}s",
                                circuitBreaker.getName(),
                                consecutiveFailures.get(),
                                recoveryTimeout.toSeconds());
                    } else {
                        log.info(
                                "Circuit breaker '{}' {} -> {}",
                                circuitBreaker.getName(),
                                event.getStateTransition().getFromState(),
                                toState);
                    }
                });
    }
}
