package com.kamisolver.search.heuristic;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.kamisolver.puzzle.Move;
import com.kamisolver.puzzle.MoveApplicator;
import com.kamisolver.puzzle.RegionGraph;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutionException;

/**
 * {@code ceil(liveEdges / bestSingleMoveReduction)}.
 *
 * <p>Every candidate move is applied to measure how many edges it removes, which makes this
 * estimator far more expensive than {@link ColorCountHeuristic}; results are memoized per
 * graph. Not admissible.
 */
@Slf4j
public class MaxEdgeReductionHeuristic implements Heuristic {

    /**
     * Maximum memoized estimates.
     */
    private static final int MAX_CACHE_ENTRIES = 50_000;

    private final MoveApplicator applicator;

    private final Cache<RegionGraph, Integer> estimates = CacheBuilder.newBuilder()
            .maximumSize(MAX_CACHE_ENTRIES)
            .recordStats()
            .build();

    public MaxEdgeReductionHeuristic(MoveApplicator applicator) {
        this.applicator = applicator;
    }

    @Override
    public String getName() {
        return HeuristicType.MAX_EDGE_REDUCTION.getDisplayName();
    }

    @Override
    public int estimate(RegionGraph graph) {
        if (graph.isSolved()) {
            return 0;
        }
        try {
            return estimates.get(graph, () -> compute(graph));
        } catch (ExecutionException e) {
            throw new IllegalStateException("Edge reduction estimate failed for " + graph, e.getCause());
        }
    }

    private int compute(RegionGraph graph) {
        int edges = graph.getEdgeCount();
        int bestReduction = 0;
        for (Move move : applicator.neighborColorMoves(graph)) {
            int reduction = edges - applicator.apply(graph, move).getEdgeCount();
            bestReduction = Math.max(bestReduction, reduction);
        }
        if (bestReduction == 0) {
            // Only reachable for a single region, which has no edges either
            return 0;
        }
        return (edges + bestReduction - 1) / bestReduction;
    }

    /**
     * Fraction of estimates served from the memo.
     */
    public double getCacheHitRate() {
        return estimates.stats().hitRate();
    }

    @Override
    public boolean isAdmissible() {
        return false;
    }
}
