package com.pricegate.application.service;

import com.pricegate.domain.model.CircuitBreakerState;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Simplified breaker: closed, or open until {@code resetTimeout} has passed since the last
 * failure. There is no half-open trial; the first call after the timeout goes live and
 * re-opens the breaker if it keeps failing.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final int threshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private final AtomicReference<CircuitBreakerState> state = new AtomicReference<>(CircuitBreakerState.closed());

    public CircuitBreaker(String name, int threshold, Duration resetTimeout, Clock clock) {
        this.name = name;
        this.threshold = threshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
    }

    public boolean allowRequest() {
        CircuitBreakerState current = state.get();
        if (current.getFailureCount() == 0) {
            return true;
        }
        if (cooledDown(current, clock.instant())) {
            if (state.compareAndSet(current, CircuitBreakerState.closed()) && current.isOpen()) {
                log.info("Circuit breaker {} closed after {}s cooldown", name, resetTimeout.toSeconds());
            }
            return true;
        }
        return !current.isOpen();
    }

    public void recordFailure() {
        Instant now = clock.instant();
        CircuitBreakerState updated = state.updateAndGet(current -> {
            CircuitBreakerState base = cooledDown(current, now) ? CircuitBreakerState.closed() : current;
            return base.withFailure(now, threshold);
        });
        if (updated.isOpen() && updated.getFailureCount() == threshold) {
            log.warn("Circuit breaker {} opened after {} consecutive failures", name, updated.getFailureCount());
        }
    }

    public void recordSuccess() {
        CircuitBreakerState previous = state.getAndSet(CircuitBreakerState.closed());
        if (previous.getFailureCount() > 0) {
            log.info("Circuit breaker {} reset after success ({} failures cleared)", name, previous.getFailureCount());
        }
    }

    public CircuitBreakerState getState() {
        return state.get();
    }

    public String getName() {
        return name;
    }

    private boolean cooledDown(CircuitBreakerState current, Instant now) {
        return current.getLastFailureAt() != null
                && Duration.between(current.getLastFailureAt(), now).compareTo(resetTimeout) > 0;
    }
}
