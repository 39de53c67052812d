package com.pricegate.application.service;

import com.pricegate.domain.model.CacheEntry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory TTL cache. Expiry is computed at read time; entries are only replaced by
 * newer writes or dropped by {@link #clear()}.
 *
 * <p>Writes are last-write-wins. Entries stored "in the future" (clock moved backwards
 * beyond the skew tolerance) are reported as misses, otherwise they would never expire.
 */
@Slf4j
public class CacheStore<T> {

    private final String name;
    private final Clock clock;
    private final Duration skewTolerance;
    private final ConcurrentHashMap<String, CacheEntry<T>> entries = new ConcurrentHashMap<>();

    public CacheStore(String name, Clock clock, Duration skewTolerance) {
        this.name = name;
        this.clock = clock;
        this.skewTolerance = skewTolerance;
    }

    /**
     * Entry regardless of age
     */
    public Optional<CacheEntry<T>> get(String key) {
        CacheEntry<T> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (entry.getStoredAt().isAfter(now.plus(skewTolerance))) {
            log.warn("Cache {} ignoring future-dated entry {} (storedAt={}, now={})",
                    name, key, entry.getStoredAt(), now);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    public void set(String key, T payload, Duration ttl) {
        entries.put(key, new CacheEntry<>(payload, clock.instant(), ttl));
        log.debug("Cache {} stored {} (ttl={}s)", name, key, ttl.toSeconds());
    }

    public boolean isValid(String key) {
        return getFresh(key).isPresent();
    }

    /**
     * Entry still within its own TTL
     */
    public Optional<CacheEntry<T>> getFresh(String key) {
        Instant now = clock.instant();
        return get(key).filter(entry -> !entry.isExpired(now));
    }

    /**
     * Entry within a caller-supplied, usually wider, staleness bound. For emergency tiers only.
     */
    public Optional<CacheEntry<T>> getRelaxed(String key, Duration maxAge) {
        Instant now = clock.instant();
        return get(key).filter(entry -> !entry.isOlderThan(maxAge, now));
    }

    public void clear() {
        int size = entries.size();
        entries.clear();
        log.info("Cache {} reset ({} entries dropped)", name, size);
    }

    public int size() {
        return entries.size();
    }

    public String getName() {
        return name;
    }
}
