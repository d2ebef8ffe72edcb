package com.example.schemacache.backend;

import com.example.schemacache.config.SchemaCacheProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Stand-in for the expensive catalog query behind the cache. Every call is
 * counted, so the counter shows how many lookups actually reached the source.
 */
@Component
public class MetadataBackend {

    private final AtomicLong requestCount = new AtomicLong();
    private final Clock clock;
    private volatile long latencyMillis;
    private volatile boolean failing;

    public MetadataBackend(SchemaCacheProperties properties, Clock clock) {
        this.latencyMillis = properties.getBackend().getLatency().toMillis();
        this.clock = clock;
    }

    // Simulates a slow metadata query
    public MetadataSnapshot fetchMetadata(String key) {
        long fetchNumber = requestCount.incrementAndGet();
        try {
            if (latencyMillis > 0) {
                Thread.sleep(latencyMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MetadataFetchException("Interrupted while fetching metadata for " + key, e);
        }
        if (failing) {
            throw new MetadataFetchException("Metadata source unavailable for " + key);
        }
        return new MetadataSnapshot(key, fetchNumber, Instant.now(clock));
    }

    public void setLatencyMillis(long ms) {
        if (ms < 0) {
            throw new IllegalArgumentException("latency must not be negative: " + ms);
        }
        this.latencyMillis = ms;
    }

    public long getLatencyMillis() {
        return latencyMillis;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public boolean isFailing() {
        return failing;
    }

    public long getRequestCount() {
        return requestCount.get();
    }

    public void resetCount() {
        requestCount.set(0);
    }
}
