package com.kamisolver.core;

import com.google.common.collect.ImmutableSet;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.kamisolver.catalog.SamplePuzzles;
import com.kamisolver.color.RegionColor;
import com.kamisolver.generator.HardestPuzzleRecord;
import com.kamisolver.puzzle.Edge;
import com.kamisolver.puzzle.MalformedGraphException;
import com.kamisolver.puzzle.Move;
import com.kamisolver.puzzle.RegionGraph;
import com.kamisolver.search.SearchResult;
import com.kamisolver.search.SearchStrategy;
import com.kamisolver.search.SolverConfig;
import com.kamisolver.search.heuristic.HeuristicType;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;
import java.util.List;

import static com.kamisolver.GraphFixtures.*;
import static org.junit.Assert.*;

/**
 * End-to-end tests of the engine as wired by Guice.
 */
public class KamiEngineTest {

    private KamiEngine engine;

    @Before
    public void setUp() {
        Injector injector = Guice.createInjector(new KamiModule());
        engine = injector.getInstance(KamiEngine.class);
    }

    @Test
    public void testSingletonWiring() {
        Injector injector = Guice.createInjector(new KamiModule(SolverConfig.OPTIMAL_BEST_FIRST));

        assertSame(injector.getInstance(KamiEngine.class), injector.getInstance(KamiEngine.class));
        assertEquals(SolverConfig.OPTIMAL_BEST_FIRST, injector.getInstance(KamiEngine.class).getDefaultSolverConfig());
    }

    @Test
    public void testBuildAndSolve() {
        RegionGraph puzzle = engine.buildPuzzle(3,
                edges(new int[][]{{0, 1}, {1, 2}}), coloring(0, 1, 0));

        List<Move> moves = engine.solve(puzzle);

        assertEquals(1, moves.size());
        assertEquals("1. Set node 1 to ORANGE", engine.render(moves));
    }

    @Test
    public void testSolveWithStrategyAndHeuristics() {
        RegionGraph puzzle = SamplePuzzles.puzzle33();

        List<Move> moves = engine.solve(puzzle, SearchStrategy.BEST_FIRST, ImmutableSet.of(HeuristicType.COLOR_COUNT));

        assertEquals(3, moves.size());
        RegionGraph current = puzzle;
        for (Move move : moves) {
            current = engine.apply(current, move);
        }
        assertTrue(current.isSolved());
    }

    @Test
    public void testSearchWithConfig() {
        SearchResult result = engine.search(star(0, 1, 2, 3, 4), SolverConfig.DEFAULT.toBuilder().maxDepth(2).build());

        assertEquals(SearchResult.Outcome.BOUND_REACHED, result.getOutcome());
    }

    @Test
    public void testRenderAlreadySolved() {
        RegionGraph puzzle = engine.buildPuzzle(1, Collections.emptySet(), coloring(3));

        assertEquals("Already solved.", engine.render(engine.solve(puzzle)));
    }

    @Test(expected = MalformedGraphException.class)
    public void testBuildRejectsDisconnected() {
        engine.buildPuzzle(3, edges(new int[][]{{0, 1}}), coloring(0, 1, 2));
    }

    @Test
    public void testFindHardest() {
        HardestPuzzleRecord record = engine.findHardest(4, 3);

        assertEquals(2, record.getMoveCount());
        assertTrue(engine.render(record).contains("\"moveCount\": 2"));
    }

    @Test
    public void testIsPlanar() {
        ImmutableSet<Edge> k4 = ImmutableSet.copyOf(edges(new int[][]{{0, 1}, {0, 2}, {0, 3}, {1, 2}, {1, 3}, {2, 3}}));
        ImmutableSet<Edge> k5 = ImmutableSet.copyOf(edges(new int[][]{{0, 1}, {0, 2}, {0, 3}, {0, 4}, {1, 2},
                {1, 3}, {1, 4}, {2, 3}, {2, 4}, {3, 4}}));

        assertTrue(engine.isPlanar(k4));
        assertTrue(engine.isPlanar(6, k4));
        assertFalse(engine.isPlanar(k5));
        assertFalse(engine.isPlanar(5, k5));
    }

    @Test
    public void testColorsPastPalette() {
        RegionGraph puzzle = engine.buildPuzzle(2, edges(new int[][]{{0, 1}}), coloring(4, 9));

        List<Move> moves = engine.solve(puzzle);

        assertEquals(1, moves.size());
        assertTrue(moves.get(0).getColor().getName().startsWith(RegionColor.SYNTHESIZED_PREFIX));
    }
}
