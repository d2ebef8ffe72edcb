package com.example.schemacache.invalidation;

import com.example.schemacache.core.CacheStore;
import com.example.schemacache.key.CacheKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes entries by exact key or by key hierarchy.
 *
 * <p>
 * In-flight fetches are left running. A fetch that started before an
 * invalidation still writes its result afterwards, so an invalidated value
 * can briefly reappear.
 */
public class Invalidator {

    private static final Logger log = LoggerFactory.getLogger(Invalidator.class);

    private final CacheStore store;

    public Invalidator(CacheStore store) {
        this.store = store;
    }

    public void invalidate(String key) {
        store.delete(key);
    }

    public int invalidateConnection(String connectionId) {
        return invalidateScope(CacheKeys.connectionKey(connectionId));
    }

    public int invalidateDatabase(String connectionId, String databaseId) {
        return invalidateScope(CacheKeys.databaseKey(connectionId, databaseId));
    }

    public int invalidateSchema(String connectionId, String databaseId, String schemaId) {
        return invalidateScope(CacheKeys.schemaKey(connectionId, databaseId, schemaId));
    }

    public void invalidateAll() {
        store.clear();
    }

    private int invalidateScope(String scopeKey) {
        int removed = store.delete(scopeKey) ? 1 : 0;
        removed += store.deleteByPrefix(CacheKeys.childPrefix(scopeKey));
        log.info("Invalidated {} cache entries under {}", removed, scopeKey);
        return removed;
    }
}
