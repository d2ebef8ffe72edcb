package com.example.schemacache.refresh;

import com.example.schemacache.core.CacheEntry;
import com.example.schemacache.core.CacheStore;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-flight fetching: concurrent callers that miss on the same key share
 * one execution of the fetcher and all observe its outcome.
 *
 * <p>
 * The hit check, the pending check and the registration of a new pending
 * fetch happen under one lock. The fetcher itself runs outside it, so a slow
 * fetch never blocks lookups of other keys. Failed fetches are not cached.
 */
public class CoalescingRefreshStrategy implements RefreshStrategy {

    private static final Logger log = LoggerFactory.getLogger(CoalescingRefreshStrategy.class);

    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public <V> CompletableFuture<V> getOrFetch(
            String key,
            Supplier<? extends CompletionStage<V>> fetcher,
            Duration ttl,
            CacheStore store) {

        CompletableFuture<Object> pending;
        boolean owner = false;

        lock.lock();
        try {
            CacheEntry<Object> entry = store.getEntry(key);
            if (entry != null) {
                V value = cast(entry.getValue());
                return CompletableFuture.completedFuture(value);
            }
            pending = inFlight.get(key);
            if (pending == null) {
                pending = new CompletableFuture<>();
                inFlight.put(key, pending);
                owner = true;
            }
        } finally {
            lock.unlock();
        }

        if (owner) {
            fetch(key, fetcher, ttl, store, pending);
        } else {
            log.debug("Joining in-flight fetch for {}", key);
        }

        // per-caller view: cancelling it leaves the shared fetch and other waiters alone
        return pending.thenApply(value -> CoalescingRefreshStrategy.<V>cast(value));
    }

    @Override
    public int inFlightCount() {
        return inFlight.size();
    }

    private <V> void fetch(
            String key,
            Supplier<? extends CompletionStage<V>> fetcher,
            Duration ttl,
            CacheStore store,
            CompletableFuture<Object> pending) {

        log.debug("Fetching {}", key);
        long start = System.nanoTime();

        CompletionStage<V> stage;
        try {
            stage = fetcher.get();
            if (stage == null) {
                stage = CompletableFuture.failedFuture(
                    new NullPointerException("Fetcher for " + key + " returned no result stage"));
            }
        } catch (Throwable t) {
            // Errors and sneaky checked exceptions too, so the pending fetch always settles
            stage = CompletableFuture.failedFuture(t);
        }

        stage.whenComplete((value, error) -> {
            lock.lock();
            try {
                if (error == null) {
                    store.set(key, value, ttl);
                }
                inFlight.remove(key, pending);
            } finally {
                lock.unlock();
            }

            if (error == null) {
                log.debug("Fetched {} in {} ms", key, (System.nanoTime() - start) / 1_000_000);
                pending.complete(value);
            } else {
                Throwable cause = unwrap(error);
                log.warn("Fetch for {} failed: {}", key, cause.toString());
                pending.completeExceptionally(cause);
            }
        });
    }

    @SuppressWarnings("unchecked")
    private static <V> V cast(Object value) {
        return (V) value;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
