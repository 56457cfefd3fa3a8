package com.kamisolver.search;

/**
 * Frontier ordering of {@link PuzzleSolver}.
 */
public enum SearchStrategy {

    /**
     * FIFO frontier. Every move costs one, so the first solved state reached is minimal.
     */
    BREADTH_FIRST,

    /**
     * Frontier ordered by {@code depth + heuristic estimate} (A*). Minimal only when every
     * enabled heuristic is admissible.
     */
    BEST_FIRST
}
