package com.example.schemacache.core;

import com.example.schemacache.invalidation.Invalidator;
import com.example.schemacache.key.CacheKeys;
import com.example.schemacache.refresh.CoalescingRefreshStrategy;
import com.example.schemacache.refresh.RefreshStrategy;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-memory TTL cache for database metadata lookups.
 *
 * <p>
 * Keys are opaque strings, usually built with {@link #buildKey}. Concurrent
 * misses on one key trigger a single fetch; failures are never cached, so the
 * next call retries. Entries expire lazily on lookup.
 */
public class SchemaCache {

    private static final int DEFAULT_LOADER_THREADS = 4;

    private final CacheStore store;
    private final RefreshStrategy refreshStrategy;
    private final Invalidator invalidator;
    private final Executor loaderExecutor;
    private final Duration defaultTtl;

    /**
     * Cache on the system clock whose entries never expire unless a TTL is
     * passed per call. Blocking loaders get a small pool of daemon threads.
     */
    public SchemaCache() {
        this(Clock.systemUTC(), null, newLoaderPool(DEFAULT_LOADER_THREADS));
    }

    /**
     * @param clock          time source for expiry checks
     * @param defaultTtl     TTL applied when a call passes none, {@code null} for no expiry
     * @param loaderExecutor runs blocking loaders handed to {@link #getOrCompute}
     */
    public SchemaCache(Clock clock, Duration defaultTtl, Executor loaderExecutor) {
        this(new CacheStore(clock), new CoalescingRefreshStrategy(), defaultTtl, loaderExecutor);
    }

    public SchemaCache(
        CacheStore store,
        RefreshStrategy refreshStrategy,
        Duration defaultTtl,
        Executor loaderExecutor
    ) {
        this.store = store;
        this.refreshStrategy = refreshStrategy;
        this.invalidator = new Invalidator(store);
        this.defaultTtl = defaultTtl;
        this.loaderExecutor = loaderExecutor;
    }

    public static String buildKey(String connectionId, String databaseId, String schemaId, String catalogId) {
        return CacheKeys.buildKey(connectionId, databaseId, schemaId, catalogId);
    }

    public <V> CompletableFuture<V> getOrFetch(String key, Supplier<? extends CompletionStage<V>> fetcher) {
        return refreshStrategy.getOrFetch(key, fetcher, defaultTtl, store);
    }

    public <V> CompletableFuture<V> getOrFetch(String key, Supplier<? extends CompletionStage<V>> fetcher, Duration ttl) {
        return refreshStrategy.getOrFetch(key, fetcher, ttl, store);
    }

    public <V> CompletableFuture<V> getOrCompute(String key, Supplier<V> loader) {
        return getOrCompute(key, loader, defaultTtl);
    }

    /**
     * Same contract as {@link #getOrFetch}, for loaders that block. The loader
     * runs on the loader executor, only when this call owns the fetch.
     */
    public <V> CompletableFuture<V> getOrCompute(String key, Supplier<V> loader, Duration ttl) {
        return getOrFetch(key, () -> CompletableFuture.supplyAsync(loader, loaderExecutor), ttl);
    }

    public void invalidate(String key) {
        invalidator.invalidate(key);
    }

    public int invalidateConnection(String connectionId) {
        return invalidator.invalidateConnection(connectionId);
    }

    public int invalidateDatabase(String connectionId, String databaseId) {
        return invalidator.invalidateDatabase(connectionId, databaseId);
    }

    public int invalidateSchema(String connectionId, String databaseId, String schemaId) {
        return invalidator.invalidateSchema(connectionId, databaseId, schemaId);
    }

    public void clear() {
        invalidator.invalidateAll();
    }

    public int sweepExpired() {
        return store.sweepExpired();
    }

    public CacheStats getStats() {
        List<String> keys = store.keys();
        Collections.sort(keys);
        return new CacheStats(store.size(), refreshStrategy.inFlightCount(), keys);
    }

    static Executor newLoaderPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "schema-cache-loader-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }
}
