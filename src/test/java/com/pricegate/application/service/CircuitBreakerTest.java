package com.pricegate.application.service;

import com.pricegate.domain.model.DataKind;
import com.pricegate.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CircuitBreaker and CircuitBreakerRegistry
 */
class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T12:00:00Z");
        breaker = new CircuitBreaker("metal", 3, Duration.ofSeconds(60), clock);
    }

    @Test
    void opensAfterThresholdFailures() {
        breaker.recordFailure();
        breaker.recordFailure();
        assertTrue(breaker.allowRequest());
        assertFalse(breaker.getState().isOpen());

        breaker.recordFailure();

        assertFalse(breaker.allowRequest());
        assertTrue(breaker.getState().isOpen());
        assertEquals(3, breaker.getState().getFailureCount());
    }

    @Test
    void closesAfterResetTimeoutWithoutTrialRequest() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        clock.advance(Duration.ofSeconds(60));
        assertFalse(breaker.allowRequest());

        clock.advance(Duration.ofSeconds(1));

        assertTrue(breaker.allowRequest());
        assertFalse(breaker.getState().isOpen());
        assertEquals(0, breaker.getState().getFailureCount());
    }

    @Test
    void reopensOnFailuresAfterCooldown() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        clock.advance(Duration.ofSeconds(61));
        assertTrue(breaker.allowRequest());

        breaker.recordFailure();
        assertTrue(breaker.allowRequest());
        breaker.recordFailure();
        breaker.recordFailure();

        assertFalse(breaker.allowRequest());
    }

    @Test
    void successResetsCount() {
        breaker.recordFailure();
        breaker.recordFailure();

        breaker.recordSuccess();
        breaker.recordFailure();

        assertTrue(breaker.allowRequest());
        assertEquals(1, breaker.getState().getFailureCount());
    }

    @Test
    void staleFailuresDoNotAccumulate() {
        breaker.recordFailure();
        breaker.recordFailure();
        clock.advance(Duration.ofMinutes(5));

        breaker.recordFailure();

        assertTrue(breaker.allowRequest());
        assertEquals(1, breaker.getState().getFailureCount());
    }

    @Test
    void registryKeepsOneBreakerPerKind() {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(3, Duration.ofSeconds(60), clock);
        for (int i = 0; i < 3; i++) {
            registry.forKind(DataKind.METAL).recordFailure();
        }

        assertFalse(registry.forKind(DataKind.METAL).allowRequest());
        assertTrue(registry.forKind(DataKind.EXCHANGE_RATE).allowRequest());
        assertSame(registry.forKind(DataKind.METAL), registry.forKind(DataKind.METAL));
        assertEquals(3, registry.states().size());
        assertTrue(registry.states().get(DataKind.METAL).isOpen());
    }
}
