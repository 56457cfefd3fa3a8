package com.kamisolver.signature;

import lombok.Value;

/**
 * Deduplication key of a puzzle state.
 *
 * <p>{@code hash} is the refinement (or histogram) hash. For exact signatures
 * {@code variant} is the index of the isomorphism class among all states seen with that
 * hash; fuzzy signatures always carry variant 0.
 */
@Value
public class CanonicalSignature {

    SignatureMode mode;
    long hash;
    int variant;

    @Override
    public String toString() {
        return String.format("%s:%016x_%d", mode, hash, variant);
    }
}
