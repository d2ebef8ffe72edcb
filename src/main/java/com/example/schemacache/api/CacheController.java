package com.example.schemacache.api;

import com.example.schemacache.backend.MetadataBackend;
import com.example.schemacache.backend.MetadataFetchException;
import com.example.schemacache.backend.MetadataSnapshot;
import com.example.schemacache.core.CacheStats;
import com.example.schemacache.core.SchemaCache;
import com.example.schemacache.key.CacheKeys;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CacheController {

    private final MetadataBackend backend;
    private final SchemaCache cache;

    public CacheController(MetadataBackend backend, SchemaCache cache) {
        this.backend = backend;
        this.cache = cache;
    }

    @GetMapping("/metadata")
    public MetadataSnapshot getMetadata(
        @RequestParam String connection,
        @RequestParam(required = false) String database,
        @RequestParam(required = false) String schema,
        @RequestParam(required = false) String category,
        @RequestParam(required = false) Long ttl
    ) throws InterruptedException {
        String key = CacheKeys.buildKey(connection, database, schema, category);
        Duration effectiveTtl = ttl != null ? Duration.ofMillis(ttl) : cache.getDefaultTtl();
        return await(cache.getOrCompute(key, () -> backend.fetchMetadata(key), effectiveTtl), key);
    }

    @DeleteMapping("/cache")
    public Map<String, Object> invalidateKey(@RequestParam String key) {
        cache.invalidate(key);
        return result("key", key, -1);
    }

    @DeleteMapping("/cache/connections/{connectionId}")
    public Map<String, Object> invalidateConnection(@PathVariable String connectionId) {
        int removed = cache.invalidateConnection(connectionId);
        return result("scope", CacheKeys.connectionKey(connectionId), removed);
    }

    @DeleteMapping("/cache/connections/{connectionId}/databases/{databaseId}")
    public Map<String, Object> invalidateDatabase(@PathVariable String connectionId, @PathVariable String databaseId) {
        int removed = cache.invalidateDatabase(connectionId, databaseId);
        return result("scope", CacheKeys.databaseKey(connectionId, databaseId), removed);
    }

    @DeleteMapping("/cache/connections/{connectionId}/databases/{databaseId}/schemas/{schemaId}")
    public Map<String, Object> invalidateSchema(
        @PathVariable String connectionId,
        @PathVariable String databaseId,
        @PathVariable String schemaId
    ) {
        int removed = cache.invalidateSchema(connectionId, databaseId, schemaId);
        return result("scope", CacheKeys.schemaKey(connectionId, databaseId, schemaId), removed);
    }

    @GetMapping("/config")
    public Map<String, Object> configure(
        @RequestParam(required = false) Long latency,
        @RequestParam(required = false) Boolean failing
    ) {
        if (latency != null) {
            backend.setLatencyMillis(latency);
        }
        if (failing != null) {
            backend.setFailing(failing);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("latency", backend.getLatencyMillis());
        body.put("failing", backend.isFailing());
        return body;
    }

    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        CacheStats stats = cache.getStats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", stats.getSize());
        body.put("inFlight", stats.getInFlight());
        body.put("keys", stats.getKeys());
        body.put("backendRequests", backend.getRequestCount());
        return body;
    }

    @GetMapping("/reset")
    public void reset() {
        backend.resetCount();
        cache.clear();
    }

    private static <V> V await(CompletableFuture<V> future, String key) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new MetadataFetchException("Metadata fetch for " + key + " failed", cause);
        }
    }

    private static Map<String, Object> result(String field, String value, int removed) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(field, value);
        if (removed >= 0) {
            body.put("removed", removed);
        }
        return body;
    }
}
