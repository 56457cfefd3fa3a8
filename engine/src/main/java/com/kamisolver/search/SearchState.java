package com.kamisolver.search;

import com.google.common.collect.ImmutableList;
import com.kamisolver.puzzle.Move;
import com.kamisolver.puzzle.RegionGraph;
import lombok.Value;

/**
 * A puzzle snapshot together with the moves that led to it from the search root.
 */
@Value
public class SearchState {

    RegionGraph graph;
    ImmutableList<Move> moves;

    public static SearchState root(RegionGraph graph) {
        return new SearchState(graph, ImmutableList.of());
    }

    public int getDepth() {
        return moves.size();
    }

    public boolean isTerminal() {
        return graph.isSolved();
    }

    SearchState child(Move move, RegionGraph next) {
        return new SearchState(next, ImmutableList.<Move>builderWithExpectedSize(moves.size() + 1)
                .addAll(moves)
                .add(move)
                .build());
    }
}
