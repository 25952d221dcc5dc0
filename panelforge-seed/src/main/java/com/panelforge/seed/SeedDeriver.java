package com.panelforge.seed;

import java.util.Objects;

/**
 * Derives a per-panel seed from the plan's global seed and the panel id. Pure: the result depends
 * only on the two arguments, never on call order or thread.
 */
public final class SeedDeriver {

    public static final long PANEL_HASH_MODULUS = 1_000_000L;
    /** Largest signed 32-bit value; derived seeds lie in {@code [0, SEED_MODULUS)}. */
    public static final long SEED_MODULUS = 2_147_483_647L;

    private SeedDeriver() {
    }

    public static int derive(long globalSeed, String panelId) {
        return explain(globalSeed, panelId).seed();
    }

    /**
     * Same as {@link #derive(long, String)} but returns every intermediate value.
     */
    public static SeedDerivation explain(long globalSeed, String panelId) {
        Objects.requireNonNull(panelId, "panelId");
        long panelHash = Long.remainderUnsigned(StableHash.fnv1a64(panelId), PANEL_HASH_MODULUS);
        // reduce first so the sum cannot overflow; equal to floorMod(globalSeed + panelHash)
        int seed = (int) Math.floorMod(Math.floorMod(globalSeed, SEED_MODULUS) + panelHash, SEED_MODULUS);
        return new SeedDerivation(globalSeed, panelId, StableHash.ALGORITHM, panelHash, seed);
    }
}
