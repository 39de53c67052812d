package com.pricegate.domain.model;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached payload with the instant it was stored and its time to live
 */
@Value
public class CacheEntry<T> {
    T payload;
    Instant storedAt;
    Duration ttl;

    public Duration age(Instant now) {
        return Duration.between(storedAt, now);
    }

    public boolean isExpired(Instant now) {
        return isOlderThan(ttl, now);
    }

    public boolean isOlderThan(Duration maxAge, Instant now) {
        return age(now).compareTo(maxAge) > 0;
    }
}
