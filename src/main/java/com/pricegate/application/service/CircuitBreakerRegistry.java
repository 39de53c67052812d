package com.pricegate.application.service;

import com.pricegate.domain.model.CircuitBreakerState;
import com.pricegate.domain.model.DataKind;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * One breaker per upstream class. Providers of a kind are attempted as a group,
 * so they share a breaker.
 */
public class CircuitBreakerRegistry {

    private final Map<DataKind, CircuitBreaker> breakers = new EnumMap<>(DataKind.class);

    public CircuitBreakerRegistry(int threshold, Duration resetTimeout, Clock clock) {
        for (DataKind kind : DataKind.values()) {
            breakers.put(kind, new CircuitBreaker(kind.getValue(), threshold, resetTimeout, clock));
        }
    }

    public CircuitBreaker forKind(DataKind kind) {
        return breakers.get(kind);
    }

    public Map<DataKind, CircuitBreakerState> states() {
        Map<DataKind, CircuitBreakerState> states = new EnumMap<>(DataKind.class);
        breakers.forEach((kind, breaker) -> states.put(kind, breaker.getState()));
        return states;
    }
}
