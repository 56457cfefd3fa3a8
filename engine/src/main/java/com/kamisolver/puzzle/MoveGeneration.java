package com.kamisolver.puzzle;

/**
 * Which moves are offered when a search state is expanded.
 */
public enum MoveGeneration {

    /**
     * Recolor a region only to a color one of its neighbors already has.
     * Every such move merges at least two regions.
     */
    NEIGHBOR_COLORS,

    /**
     * Recolor any region to any palette color it does not already have.
     * Larger branching factor; includes moves that merge nothing.
     */
    FULL_PALETTE
}
