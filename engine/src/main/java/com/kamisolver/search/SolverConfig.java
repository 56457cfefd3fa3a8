package com.kamisolver.search;

import com.google.common.collect.ImmutableSet;
import com.kamisolver.puzzle.MoveGeneration;
import com.kamisolver.search.heuristic.HeuristicType;
import com.kamisolver.signature.SignatureMode;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Configuration for {@link PuzzleSolver}.
 *
 * <p>Presets:
 * <ul>
 *   <li>{@link #DEFAULT}: breadth-first, exact signatures, always minimal</li>
 *   <li>{@link #OPTIMAL_BEST_FIRST}: A* with the admissible color-count heuristic</li>
 *   <li>{@link #FAST}: A* with every heuristic and fuzzy signatures. Neither the edge heuristic
 *       nor fuzzy deduplication preserves minimality, so solutions may be longer than optimal</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class SolverConfig {

    /**
     * Depth or expansion limit meaning "no limit".
     */
    public static final int UNBOUNDED = 0;

    public static final SolverConfig DEFAULT = SolverConfig.builder().build();

    public static final SolverConfig OPTIMAL_BEST_FIRST = SolverConfig.builder()
            .strategy(SearchStrategy.BEST_FIRST)
            .heuristics(ImmutableSet.of(HeuristicType.COLOR_COUNT))
            .build();

    public static final SolverConfig FAST = SolverConfig.builder()
            .strategy(SearchStrategy.BEST_FIRST)
            .heuristics(ImmutableSet.of(HeuristicType.COLOR_COUNT, HeuristicType.MAX_EDGE_REDUCTION))
            .signatureMode(SignatureMode.FUZZY)
            .build();

    @Builder.Default
    SearchStrategy strategy = SearchStrategy.BREADTH_FIRST;

    /**
     * Heuristics combined by maximum. Only consulted by best-first search.
     */
    @Builder.Default
    Set<HeuristicType> heuristics = ImmutableSet.of();

    @Builder.Default
    SignatureMode signatureMode = SignatureMode.EXACT;

    @Builder.Default
    MoveGeneration moveGeneration = MoveGeneration.NEIGHBOR_COLORS;

    /**
     * Longest solution searched for; {@link #UNBOUNDED} for no limit.
     */
    @Builder.Default
    int maxDepth = UNBOUNDED;

    /**
     * Most states expanded before giving up; {@link #UNBOUNDED} for no limit.
     */
    @Builder.Default
    long maxExpansions = UNBOUNDED;
}
