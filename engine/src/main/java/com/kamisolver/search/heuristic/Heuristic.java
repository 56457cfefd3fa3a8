package com.kamisolver.search.heuristic;

import com.kamisolver.puzzle.RegionGraph;

/**
 * Estimates how many moves remain before a puzzle is reduced to one region.
 *
 * <p>Implementations must be pure functions of the graph and return 0 for a solved puzzle.
 */
public interface Heuristic {

    /**
     * Human-readable name for logging.
     */
    String getName();

    /**
     * Estimate the remaining move count.
     *
     * @param graph a collapsed puzzle
     * @return a non-negative estimate
     */
    int estimate(RegionGraph graph);

    /**
     * Whether the estimate never exceeds the true remaining move count.
     * Best-first search only guarantees minimal solutions when this holds.
     */
    boolean isAdmissible();
}
