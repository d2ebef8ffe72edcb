package com.example.schemacache.core;

public class CacheEntry<V> {

    public static final long NEVER = Long.MAX_VALUE;

    private final V value;
    private final long expiresAt;   // absolute timestamp in millis, NEVER when no TTL was given

    public CacheEntry(V value, long expiresAt) {
        this.value = value;
        this.expiresAt = expiresAt;
    }

    public V getValue() {
        return value;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public boolean isLive(long nowMillis) {
        return expiresAt == NEVER || expiresAt > nowMillis;
    }
}
