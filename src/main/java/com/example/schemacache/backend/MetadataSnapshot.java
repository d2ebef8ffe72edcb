package com.example.schemacache.backend;

import java.time.Instant;

/** Result of one metadata query against the simulated backend. */
public class MetadataSnapshot {

    private final String key;
    private final long fetchNumber;
    private final Instant fetchedAt;

    public MetadataSnapshot(String key, long fetchNumber, Instant fetchedAt) {
        this.key = key;
        this.fetchNumber = fetchNumber;
        this.fetchedAt = fetchedAt;
    }

    public String getKey() {
        return key;
    }

    public long getFetchNumber() {
        return fetchNumber;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }
}
