package com.example.schemacache.config;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.example.schemacache.core.SchemaCache;
import com.example.schemacache.support.MutableClock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;

class ExpiredEntrySweeperTest {

    @Test
    void sweepDropsOnlyExpiredEntries() throws Exception {
        MutableClock clock = MutableClock.atEpoch();
        SchemaCache cache = new SchemaCache(clock, null, Runnable::run);
        cache.getOrFetch("short", () -> CompletableFuture.completedFuture(1), Duration.ofSeconds(1)).get();
        cache.getOrFetch("long", () -> CompletableFuture.completedFuture(2), Duration.ofHours(1)).get();

        clock.advance(Duration.ofSeconds(2));
        assertEquals(2, cache.getStats().getSize());

        new ExpiredEntrySweeper(cache).sweep();

        assertEquals(List.of("long"), cache.getStats().getKeys());
    }
}
