package com.example.schemacache.invalidation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.schemacache.core.CacheStore;
import com.example.schemacache.key.CacheKeys;
import com.example.schemacache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InvalidatorTest {

    private CacheStore store;
    private Invalidator invalidator;

    @BeforeEach
    void setUp() {
        store = new CacheStore(MutableClock.atEpoch());
        invalidator = new Invalidator(store);
        store.set(CacheKeys.buildKey("a"), "root", null);
        store.set(CacheKeys.buildKey("a", "db"), "db", null);
        store.set(CacheKeys.buildKey("a", "db", "public", "tables"), "tables", null);
        store.set(CacheKeys.buildKey("ab", "db"), "other", null);
        store.set("adhoc", "x", null);
    }

    @Test
    void connectionInvalidationRemovesWholeHierarchyIncludingBareKey() {
        assertEquals(3, invalidator.invalidateConnection("a"));

        assertEquals(2, store.size());
        assertTrue(store.get(CacheKeys.buildKey("ab", "db")).isPresent());
        assertTrue(store.get("adhoc").isPresent());
    }

    @Test
    void unknownConnectionIsNoOp() {
        assertEquals(0, invalidator.invalidateConnection("missing"));
        assertEquals(5, store.size());
    }

    @Test
    void exactInvalidationRemovesOnlyThatKey() {
        invalidator.invalidate(CacheKeys.buildKey("a", "db"));

        assertFalse(store.get(CacheKeys.buildKey("a", "db")).isPresent());
        assertTrue(store.get(CacheKeys.buildKey("a", "db", "public", "tables")).isPresent());
        assertEquals(4, store.size());
    }

    @Test
    void invalidateAllEmptiesStore() {
        invalidator.invalidateAll();

        assertEquals(0, store.size());
    }
}
