package com.kamisolver.search;

import com.kamisolver.color.RegionColor;
import com.kamisolver.puzzle.Move;
import com.kamisolver.puzzle.MoveApplicator;
import com.kamisolver.puzzle.RegionGraph;
import com.kamisolver.puzzle.UnsolvableException;
import com.kamisolver.search.heuristic.Heuristic;
import com.kamisolver.search.heuristic.HeuristicRegistry;
import com.kamisolver.signature.CanonicalSignature;
import com.kamisolver.signature.SignatureCache;
import com.kamisolver.signature.StateCanonicalizer;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Queue;
import java.util.Set;

/**
 * Shortest-path search from a puzzle to a single-region state.
 *
 * <p>States are expanded with {@link MoveApplicator} and deduplicated on
 * {@link CanonicalSignature}s: a generated state whose signature was already reached at an
 * equal or lower depth is dropped. Breadth-first search tests for the goal when a state is
 * generated; best-first search tests when a state leaves the frontier, which keeps it
 * minimal under admissible heuristics.
 *
 * <p>A solver instance is single-threaded. Without a shared {@link SignatureCache} every run
 * gets a fresh one.
 */
@Slf4j
public class PuzzleSolver {

    @Getter
    private final SolverConfig config;

    private final MoveApplicator applicator;

    @Getter
    private final Heuristic heuristic;

    @Nullable
    private final SignatureCache sharedCache;

    public PuzzleSolver(SolverConfig config, HeuristicRegistry registry, MoveApplicator applicator) {
        this(config, registry, applicator, null);
    }

    /**
     * @param sharedCache cache reused by every run of this solver, or null for one per run
     */
    public PuzzleSolver(SolverConfig config, HeuristicRegistry registry, MoveApplicator applicator,
                        @Nullable SignatureCache sharedCache) {
        if (config == null) {
            throw new IllegalArgumentException("Solver config cannot be null");
        }
        this.config = config;
        this.applicator = applicator;
        this.heuristic = registry.combine(config.getHeuristics());
        this.sharedCache = sharedCache;
    }

    /**
     * Find a shortest move sequence.
     *
     * @param graph the collapsed starting puzzle
     * @return the moves in order; empty if already solved
     * @throws UnsolvableException if the search ends without a solution
     */
    public List<Move> solve(RegionGraph graph) {
        SearchResult result = search(graph);
        if (!result.isSolved()) {
            throw new UnsolvableException("No solution found (" + result.getOutcome() + " after "
                    + result.getExpandedStates() + " expansions) for " + graph);
        }
        return result.getMoves();
    }

    /**
     * Search with the configured ceilings.
     */
    public SearchResult search(RegionGraph graph) {
        return search(graph, config.getMaxDepth());
    }

    /**
     * Search for a solution of at most {@code maxDepth} moves.
     *
     * @param maxDepth longest solution of interest, or {@link SolverConfig#UNBOUNDED}
     * @return the outcome; {@link SearchResult.Outcome#BOUND_REACHED} if no solution fits
     */
    public SearchResult search(RegionGraph graph, int maxDepth) {
        if (graph == null) {
            throw new IllegalArgumentException("Puzzle cannot be null");
        }
        if (graph.isSolved()) {
            return SearchResult.builder().outcome(SearchResult.Outcome.SOLVED).build();
        }

        StateCanonicalizer canonicalizer = new StateCanonicalizer(config.getSignatureMode(),
                sharedCache != null ? sharedCache : new SignatureCache());
        Run run = new Run(canonicalizer, graph.getColors(), maxDepth);

        log.debug("Searching {} regions with {} (heuristic: {}, signatures: {}, bound: {})",
                graph.size(), config.getStrategy(), heuristic.getName(), config.getSignatureMode(), maxDepth);

        SearchResult result = config.getStrategy() == SearchStrategy.BEST_FIRST
                ? run.bestFirst(graph)
                : run.breadthFirst(graph);

        if (result.getOutcome() == SearchResult.Outcome.EXHAUSTED) {
            log.warn("Search exhausted after {} expansions without reaching a single region", result.getExpandedStates());
        } else {
            log.debug("Search finished: {} in {} moves ({} expanded, {} generated, {} duplicates)",
                    result.getOutcome(), result.getMoveCount(), result.getExpandedStates(),
                    result.getGeneratedStates(), result.getDuplicateStates());
        }
        return result;
    }

    @Value
    private static class FrontierEntry {
        SearchState state;
        CanonicalSignature signature;
        int estimate;
        long sequence;

        int getPriority() {
            return state.getDepth() + estimate;
        }
    }

    private static final Comparator<FrontierEntry> FRONTIER_ORDER = Comparator
            .comparingInt(FrontierEntry::getPriority)
            .thenComparingInt(FrontierEntry::getEstimate)
            .thenComparingLong(FrontierEntry::getSequence);

    /**
     * Mutable bookkeeping of one search.
     */
    private class Run {
        private final StateCanonicalizer canonicalizer;
        private final Set<RegionColor> palette;
        private final int maxDepth;
        private final Map<CanonicalSignature, Integer> bestDepth = new HashMap<>();

        private long expanded;
        private long generated;
        private long duplicates;
        private int peakFrontier;
        private boolean boundHit;

        Run(StateCanonicalizer canonicalizer, Set<RegionColor> palette, int maxDepth) {
            this.canonicalizer = canonicalizer;
            this.palette = palette;
            this.maxDepth = maxDepth;
        }

        SearchResult breadthFirst(RegionGraph start) {
            Queue<SearchState> frontier = new ArrayDeque<>();
            bestDepth.put(canonicalizer.signature(start), 0);
            frontier.add(SearchState.root(start));

            while (!frontier.isEmpty()) {
                if (expansionLimitReached()) {
                    return finish(SearchResult.Outcome.BOUND_REACHED, null);
                }
                SearchState state = frontier.poll();
                if (atDepthLimit(state)) {
                    continue;
                }
                expanded++;

                for (Move move : moves(state)) {
                    SearchState child = state.child(move, applicator.apply(state.getGraph(), move));
                    generated++;
                    if (child.isTerminal()) {
                        return finish(SearchResult.Outcome.SOLVED, child);
                    }
                    if (record(canonicalizer.signature(child.getGraph()), child.getDepth())) {
                        frontier.add(child);
                    }
                }
                peakFrontier = Math.max(peakFrontier, frontier.size());
            }
            return finish(boundHit ? SearchResult.Outcome.BOUND_REACHED : SearchResult.Outcome.EXHAUSTED, null);
        }

        SearchResult bestFirst(RegionGraph start) {
            PriorityQueue<FrontierEntry> frontier = new PriorityQueue<>(FRONTIER_ORDER);
            long sequence = 0;
            CanonicalSignature rootSignature = canonicalizer.signature(start);
            bestDepth.put(rootSignature, 0);
            frontier.add(new FrontierEntry(SearchState.root(start), rootSignature, heuristic.estimate(start), sequence++));

            while (!frontier.isEmpty()) {
                FrontierEntry entry = frontier.poll();
                SearchState state = entry.getState();
                if (state.getDepth() > bestDepth.get(entry.getSignature())) {
                    // Superseded by a shallower path to the same state
                    continue;
                }
                if (state.isTerminal()) {
                    return finish(SearchResult.Outcome.SOLVED, state);
                }
                if (expansionLimitReached()) {
                    return finish(SearchResult.Outcome.BOUND_REACHED, null);
                }
                if (atDepthLimit(state)) {
                    continue;
                }
                expanded++;

                for (Move move : moves(state)) {
                    SearchState child = state.child(move, applicator.apply(state.getGraph(), move));
                    generated++;
                    CanonicalSignature signature = canonicalizer.signature(child.getGraph());
                    if (record(signature, child.getDepth())) {
                        frontier.add(new FrontierEntry(child, signature, heuristic.estimate(child.getGraph()), sequence++));
                    }
                }
                peakFrontier = Math.max(peakFrontier, frontier.size());
            }
            return finish(boundHit ? SearchResult.Outcome.BOUND_REACHED : SearchResult.Outcome.EXHAUSTED, null);
        }

        private List<Move> moves(SearchState state) {
            return applicator.validMoves(state.getGraph(), config.getMoveGeneration(), palette);
        }

        /**
         * Remember the depth a signature was reached at.
         *
         * @return false if the signature was already reached at an equal or lower depth
         */
        private boolean record(CanonicalSignature signature, int depth) {
            Integer previous = bestDepth.get(signature);
            if (previous != null && previous <= depth) {
                duplicates++;
                return false;
            }
            bestDepth.put(signature, depth);
            return true;
        }

        private boolean atDepthLimit(SearchState state) {
            if (maxDepth > SolverConfig.UNBOUNDED && state.getDepth() >= maxDepth) {
                boundHit = true;
                return true;
            }
            return false;
        }

        private boolean expansionLimitReached() {
            return config.getMaxExpansions() > SolverConfig.UNBOUNDED && expanded >= config.getMaxExpansions();
        }

        private SearchResult finish(SearchResult.Outcome outcome, @Nullable SearchState solved) {
            SearchResult.SearchResultBuilder builder = SearchResult.builder()
                    .outcome(outcome)
                    .expandedStates(expanded)
                    .generatedStates(generated)
                    .duplicateStates(duplicates)
                    .peakFrontierSize(peakFrontier);
            if (solved != null) {
                builder.moves(solved.getMoves());
            }
            return builder.build();
        }
    }
}
