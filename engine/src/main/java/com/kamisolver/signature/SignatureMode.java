package com.kamisolver.signature;

/**
 * Precision of the state signatures used to deduplicate search states.
 */
public enum SignatureMode {

    /**
     * Refinement to a fixed point backed by an isomorphism check against earlier states with
     * the same refinement hash. Equal signatures mean the puzzles are identical up to region
     * renaming, with colors preserved.
     */
    EXACT,

    /**
     * One pass over (color, neighbor colors) per region, aggregated into a histogram.
     *
     * <p>Distinct puzzles can share a fuzzy signature. A search deduplicating on fuzzy
     * signatures can then drop a state it has never explored and may return a longer
     * solution than the optimum. Use it only where throughput matters more than minimality.
     */
    FUZZY
}
