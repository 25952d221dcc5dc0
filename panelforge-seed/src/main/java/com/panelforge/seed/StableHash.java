package com.panelforge.seed;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * FNV-1a 64-bit over the UTF-8 bytes of a string.
 * <p>
 * Unlike {@link String#hashCode()} or a salted runtime hash, the value depends only on the bytes,
 * so it is identical across processes, restarts and implementations. The algorithm id is part of
 * the on-disk format: changing the function means bumping {@link #ALGORITHM}.
 */
public final class StableHash {

    public static final String ALGORITHM = "fnv1a-64/v1";

    static final long OFFSET_BASIS = 0xcbf29ce484222325L;
    static final long PRIME = 0x100000001b3L;

    private StableHash() {
    }

    public static long fnv1a64(String value) {
        Objects.requireNonNull(value, "value");
        long hash = OFFSET_BASIS;
        for (byte b : value.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= PRIME;
        }
        return hash;
    }
}
