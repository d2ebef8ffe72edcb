package com.example.schemacache.refresh;

import com.example.schemacache.core.CacheStore;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

public interface RefreshStrategy {

    <V> CompletableFuture<V> getOrFetch(
        String key,
        Supplier<? extends CompletionStage<V>> fetcher,
        Duration ttl,
        CacheStore store
    );

    int inFlightCount();
}
