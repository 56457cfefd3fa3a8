package com.kamisolver.generator;

import com.kamisolver.search.SolverConfig;
import com.kamisolver.signature.SignatureMode;
import lombok.Builder;
import lombok.Value;

/**
 * Configuration for {@link PuzzleGenerator}.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorConfig {

    int nodeCount;

    /**
     * Exact number of distinct colors in each generated coloring.
     */
    int colorCount;

    /**
     * Solver used to measure each candidate. Depth and expansion ceilings are ignored: every
     * kept candidate is solved to completion. Results are only optimal with an optimal solver.
     */
    @Builder.Default
    SolverConfig solver = SolverConfig.DEFAULT;

    /**
     * Worker threads; topologies are sharded across them by mask.
     */
    @Builder.Default
    int workers = 1;

    /**
     * Skip candidates whose signature was already evaluated by the same worker.
     */
    @Builder.Default
    boolean deduplicate = false;

    /**
     * Signature precision for candidate deduplication. Fuzzy signatures can skip puzzles
     * that are not duplicates, including the hardest one.
     */
    @Builder.Default
    SignatureMode deduplicationMode = SignatureMode.EXACT;

    /**
     * Keep one signature cache per worker for all of its solver runs instead of one per run.
     * Faster for small spaces; memory grows with every distinct state seen.
     */
    @Builder.Default
    boolean reuseSignatureCache = false;

    /**
     * First topology mask to enumerate, to resume an interrupted run.
     */
    @Builder.Default
    long startMask = 0L;

    /**
     * Log progress every this many topologies (per worker).
     */
    @Builder.Default
    int progressInterval = 1000;
}
