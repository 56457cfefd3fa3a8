package com.kamisolver.search.heuristic;

import com.kamisolver.puzzle.MoveApplicator;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry of heuristics by type.
 *
 * <p>Both built-in heuristics are registered at construction time. A type can be re-bound
 * with {@link #registerHeuristic}, e.g. to a tuned or instrumented estimator.
 */
@Slf4j
@Singleton
public class HeuristicRegistry {

    private final Map<HeuristicType, Heuristic> heuristicsByType = new EnumMap<>(HeuristicType.class);

    /**
     * Create a new registry with the default heuristics.
     */
    @Inject
    public HeuristicRegistry(MoveApplicator applicator) {
        registerHeuristic(HeuristicType.COLOR_COUNT, new ColorCountHeuristic());
        registerHeuristic(HeuristicType.MAX_EDGE_REDUCTION, new MaxEdgeReductionHeuristic(applicator));

        log.debug("HeuristicRegistry initialized with {} heuristics", heuristicsByType.size());
    }

    /**
     * Register a heuristic, replacing any existing one for the type.
     */
    public void registerHeuristic(HeuristicType type, Heuristic heuristic) {
        if (type == null || heuristic == null) {
            throw new IllegalArgumentException("Heuristic type and heuristic cannot be null");
        }
        if (heuristicsByType.containsKey(type)) {
            log.warn("Replacing existing heuristic for type: {}", type);
        }
        heuristicsByType.put(type, heuristic);
    }

    public Optional<Heuristic> getHeuristic(HeuristicType type) {
        return Optional.ofNullable(heuristicsByType.get(type));
    }

    public Set<HeuristicType> getRegisteredTypes() {
        return Collections.unmodifiableSet(heuristicsByType.keySet());
    }

    /**
     * Combine the heuristics of the given types by maximum.
     *
     * @throws IllegalArgumentException if a type has no registered heuristic
     */
    public Heuristic combine(Set<HeuristicType> types) {
        List<Heuristic> components = new ArrayList<>();
        for (HeuristicType type : HeuristicType.values()) {
            if (!types.contains(type)) {
                continue;
            }
            Heuristic heuristic = heuristicsByType.get(type);
            if (heuristic == null) {
                throw new IllegalArgumentException("No heuristic registered for " + type);
            }
            components.add(heuristic);
        }
        CombinedHeuristic combined = new CombinedHeuristic(components);
        if (!combined.isAdmissible()) {
            log.warn("Heuristic set {} is not admissible; best-first results may not be minimal", types);
        }
        return combined;
    }
}
