package com.example.schemacache.loadgen;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class LoadGeneratorTest {

    @Test
    void metadataUriSkipsAbsentSegments() {
        assertEquals("http://localhost:8080/metadata?connection=c1&category=tables",
            LoadGenerator.metadataUri("http://localhost:8080", "c1", null, null, "tables").toString());
    }

    @Test
    void metadataUriEncodesValues() {
        assertEquals("http://h/metadata?connection=my%20conn&database=a%26b",
            LoadGenerator.metadataUri("http://h", "my conn", "a&b", null, null).toString());
    }

    @Test
    void invalidateUriTargetsConnectionScope() {
        assertEquals("http://h/cache/connections/conn-7",
            LoadGenerator.invalidateConnectionUri("http://h", "conn-7").toString());
    }

    @Test
    void invalidateUriPercentEncodesPathSegment() {
        assertEquals("http://h/cache/connections/my%20conn",
            LoadGenerator.invalidateConnectionUri("http://h", "my conn").toString());
    }
}
