package com.kamisolver.core;

import com.google.common.collect.ImmutableSet;
import com.kamisolver.color.RegionColor;
import com.kamisolver.generator.GeneratorConfig;
import com.kamisolver.generator.HardestPuzzleRecord;
import com.kamisolver.generator.PlanarityTester;
import com.kamisolver.generator.PuzzleGenerator;
import com.kamisolver.puzzle.Edge;
import com.kamisolver.puzzle.Move;
import com.kamisolver.puzzle.MoveApplicator;
import com.kamisolver.puzzle.RegionGraph;
import com.kamisolver.puzzle.RegionGraphs;
import com.kamisolver.render.MoveListRenderer;
import com.kamisolver.search.PuzzleSolver;
import com.kamisolver.search.SearchResult;
import com.kamisolver.search.SearchStrategy;
import com.kamisolver.search.SolverConfig;
import com.kamisolver.search.heuristic.HeuristicRegistry;
import com.kamisolver.search.heuristic.HeuristicType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for building, solving and generating puzzles.
 *
 * <p>Obtain an instance from {@code Guice.createInjector(new KamiModule())}.
 */
@Slf4j
@Singleton
public class KamiEngine {

    private final MoveApplicator applicator;
    private final HeuristicRegistry heuristics;
    private final PlanarityTester planarity;
    private final PuzzleGenerator generator;
    private final MoveListRenderer renderer;

    @Getter
    private final SolverConfig defaultSolverConfig;

    @Inject
    public KamiEngine(MoveApplicator applicator, HeuristicRegistry heuristics, PlanarityTester planarity,
                      PuzzleGenerator generator, MoveListRenderer renderer, SolverConfig defaultSolverConfig) {
        this.applicator = applicator;
        this.heuristics = heuristics;
        this.planarity = planarity;
        this.generator = generator;
        this.renderer = renderer;
        this.defaultSolverConfig = defaultSolverConfig;
    }

    /**
     * Build a collapsed puzzle from regions {@code 0..nodeCount-1}.
     *
     * @throws com.kamisolver.puzzle.MalformedGraphException if the input does not describe
     *                                                       a connected puzzle
     */
    public RegionGraph buildPuzzle(int nodeCount, Set<Edge> adjacency, Map<Integer, RegionColor> coloring) {
        return RegionGraphs.build(nodeCount, adjacency, coloring);
    }

    /**
     * Solve with the default solver configuration.
     */
    public List<Move> solve(RegionGraph puzzle) {
        return newSolver(defaultSolverConfig).solve(puzzle);
    }

    /**
     * Solve with the given strategy and heuristics; other settings come from the default
     * configuration.
     *
     * @throws com.kamisolver.puzzle.UnsolvableException if no solution is found
     */
    public List<Move> solve(RegionGraph puzzle, SearchStrategy strategy, Set<HeuristicType> heuristicTypes) {
        return newSolver(defaultSolverConfig.toBuilder()
                .strategy(strategy)
                .heuristics(ImmutableSet.copyOf(heuristicTypes))
                .build())
                .solve(puzzle);
    }

    public SearchResult search(RegionGraph puzzle, SolverConfig config) {
        return newSolver(config).search(puzzle);
    }

    public RegionGraph apply(RegionGraph puzzle, Move move) {
        return applicator.apply(puzzle, move);
    }

    public HardestPuzzleRecord findHardest(int nodeCount, int colorCount) {
        return generator.findHardest(nodeCount, colorCount);
    }

    public Optional<HardestPuzzleRecord> findHardest(GeneratorConfig config) {
        return generator.findHardest(config);
    }

    /**
     * Planarity of a graph given only by its edges; isolated vertices do not matter.
     */
    public boolean isPlanar(Set<Edge> edges) {
        return planarity.isPlanar(edges);
    }

    public boolean isPlanar(int nodeCount, Set<Edge> edges) {
        return planarity.isPlanar(nodeCount, edges);
    }

    public String render(List<Move> moves) {
        return renderer.renderMoves(moves);
    }

    public String render(HardestPuzzleRecord record) {
        return renderer.toJson(record);
    }

    private PuzzleSolver newSolver(SolverConfig config) {
        log.debug("Creating solver: {}", config);
        return new PuzzleSolver(config, heuristics, applicator);
    }
}
