package com.panelforge.seed;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inputs and intermediate values of one seed derivation, recorded so the seed can be recomputed
 * independently.
 *
 * @param globalSeed plan-level seed
 * @param panelId    panel identifier that was hashed
 * @param algorithm  hash algorithm id ({@link StableHash#ALGORITHM})
 * @param panelHash  {@code unsigned(hash) mod 1_000_000}
 * @param seed       derived seed
 */
public record SeedDerivation(
        @JsonProperty("global_seed") long globalSeed,
        @JsonProperty("panel_id") String panelId,
        @JsonProperty("hash_algorithm") String algorithm,
        @JsonProperty("panel_hash") long panelHash,
        @JsonProperty("seed") int seed) {
}
