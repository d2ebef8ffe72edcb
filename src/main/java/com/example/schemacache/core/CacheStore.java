package com.example.schemacache.core;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Key to timestamped entry table. Expiry is checked lazily on read; nothing
 * is removed in the background unless {@link #sweepExpired()} is called.
 */
public class CacheStore {

    private final ConcurrentHashMap<String, CacheEntry<Object>> store = new ConcurrentHashMap<>();
    private final Clock clock;

    public CacheStore(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Value of the live entry for {@code key}. A cached {@code null} reads as
     * empty here, same as a miss; use {@link #getEntry} to tell them apart.
     */
    public Optional<Object> get(String key) {
        CacheEntry<Object> entry = getEntry(key);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.getValue());
    }

    /**
     * Returns the live entry for {@code key}, or {@code null} on a miss. An
     * expired entry seen here is dropped.
     */
    public CacheEntry<Object> getEntry(String key) {
        CacheEntry<Object> entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (!entry.isLive(clock.millis())) {
            store.remove(key, entry);
            return null;
        }
        return entry;
    }

    public void set(String key, Object value, Duration ttl) {
        store.put(key, new CacheEntry<>(value, expiryFor(ttl)));
    }

    public boolean delete(String key) {
        return store.remove(key) != null;
    }

    public int deleteByPrefix(String prefix) {
        int removed = 0;
        for (String key : store.keySet()) {
            if (key.startsWith(prefix) && store.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    public void clear() {
        store.clear();
    }

    // Table occupancy, expired-but-unswept entries included
    public int size() {
        return store.size();
    }

    public List<String> keys() {
        return new ArrayList<>(store.keySet());
    }

    public int sweepExpired() {
        long now = clock.millis();
        int removed = 0;
        for (Map.Entry<String, CacheEntry<Object>> e : store.entrySet()) {
            if (!e.getValue().isLive(now) && store.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    private long expiryFor(Duration ttl) {
        if (ttl == null) {
            return CacheEntry.NEVER;
        }
        long now = clock.millis();
        long ttlMillis = ttl.toMillis();
        // zero or negative TTL: written, but already expired on the next lookup
        if (ttlMillis <= 0) {
            return now;
        }
        return ttlMillis >= CacheEntry.NEVER - now ? CacheEntry.NEVER - 1 : now + ttlMillis;
    }
}
