package com.example.schemacache.core;

import java.util.Collections;
import java.util.List;

public final class CacheStats {

    private final int size;
    private final int inFlight;
    private final List<String> keys;

    public CacheStats(int size, int inFlight, List<String> keys) {
        this.size = size;
        this.inFlight = inFlight;
        this.keys = Collections.unmodifiableList(keys);
    }

    public int getSize() {
        return size;
    }

    public int getInFlight() {
        return inFlight;
    }

    public List<String> getKeys() {
        return keys;
    }
}
