package com.kamisolver.generator;

import com.google.common.collect.ImmutableList;
import com.kamisolver.puzzle.Move;
import com.kamisolver.puzzle.RegionGraph;
import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;
import java.util.List;

/**
 * The hardest instance found so far: the puzzle, its optimal move count and one optimal
 * solution.
 */
@Value
@Builder
public class HardestPuzzleRecord {

    /**
     * Topology and coloring the puzzle was generated from, with its enumeration position.
     */
    PuzzleCandidate candidate;

    /**
     * The collapsed puzzle.
     */
    RegionGraph puzzle;

    int moveCount;

    @Builder.Default
    List<Move> solution = ImmutableList.of();

    /**
     * Whether this record should replace {@code current}: strictly more moves, or as many
     * moves at an earlier enumeration position.
     */
    public boolean beats(@Nullable HardestPuzzleRecord current) {
        if (current == null) {
            return true;
        }
        if (moveCount != current.moveCount) {
            return moveCount > current.moveCount;
        }
        return candidate.compareTo(current.candidate) < 0;
    }
}
