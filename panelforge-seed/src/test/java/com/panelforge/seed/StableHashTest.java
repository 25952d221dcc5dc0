package com.panelforge.seed;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class StableHashTest {

    @Test
    void fnv1a64_matchesPublishedVectors() {
        assertEquals(0xcbf29ce484222325L, StableHash.fnv1a64(""));
        assertEquals(0xaf63dc4c8601ec8cL, StableHash.fnv1a64("a"));
        assertEquals(0x85944171f73967e8L, StableHash.fnv1a64("foobar"));
    }

    @Test
    void fnv1a64_hashesUtf8BytesNotChars() {
        assertEquals(0x82f43520142e9031L, StableHash.fnv1a64("héros"));
    }

    @Test
    void fnv1a64_ignoresStringHashCodeCollisions() {
        // "Aa" and "BB" share String.hashCode()
        assertEquals("Aa".hashCode(), "BB".hashCode());
        assertNotEquals(StableHash.fnv1a64("Aa"), StableHash.fnv1a64("BB"));
    }
}
