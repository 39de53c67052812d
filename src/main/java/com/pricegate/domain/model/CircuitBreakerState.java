package com.pricegate.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Failure bookkeeping of one upstream class
 */
@Value
public class CircuitBreakerState {
    int failureCount;
    Instant lastFailureAt;  // null until the first failure
    boolean open;

    public static CircuitBreakerState closed() {
        return new CircuitBreakerState(0, null, false);
    }

    public CircuitBreakerState withFailure(Instant at, int threshold) {
        int count = failureCount + 1;
        return new CircuitBreakerState(count, at, count >= threshold);
    }
}
