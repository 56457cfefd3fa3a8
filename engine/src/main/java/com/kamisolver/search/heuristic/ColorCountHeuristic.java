package com.kamisolver.search.heuristic;

import com.kamisolver.puzzle.RegionGraph;

/**
 * {@code distinct colors - 1}: each move can make at most one color disappear.
 */
public class ColorCountHeuristic implements Heuristic {

    @Override
    public String getName() {
        return HeuristicType.COLOR_COUNT.getDisplayName();
    }

    @Override
    public int estimate(RegionGraph graph) {
        return Math.max(0, graph.getColors().size() - 1);
    }

    @Override
    public boolean isAdmissible() {
        return true;
    }
}
