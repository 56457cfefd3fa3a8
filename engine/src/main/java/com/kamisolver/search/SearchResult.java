package com.kamisolver.search;

import com.google.common.collect.ImmutableList;
import com.kamisolver.puzzle.Move;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a single {@link PuzzleSolver} run with its statistics.
 */
@Value
@Builder
public class SearchResult {

    public enum Outcome {
        /**
         * A single-region state was reached; {@code moves} holds the path.
         */
        SOLVED,

        /**
         * A depth or expansion ceiling stopped the search before a solution was found.
         */
        BOUND_REACHED,

        /**
         * The frontier emptied without a solution.
         */
        EXHAUSTED
    }

    Outcome outcome;

    /**
     * Moves of the solution; empty unless solved.
     */
    @Builder.Default
    List<Move> moves = ImmutableList.of();

    long expandedStates;
    long generatedStates;
    long duplicateStates;
    int peakFrontierSize;

    public boolean isSolved() {
        return outcome == Outcome.SOLVED;
    }

    public int getMoveCount() {
        return moves.size();
    }
}
