package com.example.schemacache.key;

import java.util.Objects;

/**
 * Builds hierarchical cache keys of the form
 * {@code conn:<id>:db:<id>:schema:<id>:cat:<id>}.
 *
 * <p>
 * Segments are rendered in fixed order and absent ({@code null} or empty)
 * segments are left out. Callers composing keys by hand must use the same
 * labels, otherwise connection-scoped invalidation will not find them.
 */
public final class CacheKeys {

    public static final String CONNECTION = "conn";
    public static final String DATABASE = "db";
    public static final String SCHEMA = "schema";
    public static final String CATALOG = "cat";

    public static final char SEPARATOR = ':';

    private CacheKeys() {
    }

    public static String buildKey(String connectionId) {
        return buildKey(connectionId, null, null, null);
    }

    public static String buildKey(String connectionId, String databaseId) {
        return buildKey(connectionId, databaseId, null, null);
    }

    public static String buildKey(String connectionId, String databaseId, String schemaId) {
        return buildKey(connectionId, databaseId, schemaId, null);
    }

    public static String buildKey(String connectionId, String databaseId, String schemaId, String catalogId) {
        Objects.requireNonNull(connectionId, "connectionId");
        StringBuilder sb = new StringBuilder();
        append(sb, CONNECTION, connectionId);
        if (isPresent(databaseId)) {
            append(sb, DATABASE, databaseId);
        }
        if (isPresent(schemaId)) {
            append(sb, SCHEMA, schemaId);
        }
        if (isPresent(catalogId)) {
            append(sb, CATALOG, catalogId);
        }
        return sb.toString();
    }

    public static String connectionKey(String connectionId) {
        return buildKey(connectionId);
    }

    public static String databaseKey(String connectionId, String databaseId) {
        requirePresent(databaseId, "databaseId");
        return buildKey(connectionId, databaseId);
    }

    public static String schemaKey(String connectionId, String databaseId, String schemaId) {
        requirePresent(databaseId, "databaseId");
        requirePresent(schemaId, "schemaId");
        return buildKey(connectionId, databaseId, schemaId);
    }

    /**
     * Prefix shared by every key nested below {@code scopeKey}. Keeps the
     * trailing separator so {@code conn:a:} never matches {@code conn:ab:...}.
     */
    public static String childPrefix(String scopeKey) {
        return scopeKey + SEPARATOR;
    }

    private static void append(StringBuilder sb, String label, String value) {
        if (sb.length() > 0) {
            sb.append(SEPARATOR);
        }
        sb.append(label).append(SEPARATOR).append(value);
    }

    private static boolean isPresent(String segment) {
        return segment != null && !segment.isEmpty();
    }

    private static void requirePresent(String segment, String name) {
        if (!isPresent(segment)) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }
}
