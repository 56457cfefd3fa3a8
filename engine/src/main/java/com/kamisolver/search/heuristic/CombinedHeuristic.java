package com.kamisolver.search.heuristic;

import com.google.common.collect.ImmutableList;
import com.kamisolver.puzzle.RegionGraph;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maximum over a set of heuristics. Admissible exactly when every component is.
 * With no components it estimates 0, which turns best-first into uniform-cost search.
 */
public class CombinedHeuristic implements Heuristic {

    private final ImmutableList<Heuristic> components;

    public CombinedHeuristic(List<Heuristic> components) {
        this.components = ImmutableList.copyOf(components);
    }

    public List<Heuristic> getComponents() {
        return components;
    }

    @Override
    public String getName() {
        if (components.isEmpty()) {
            return "None";
        }
        return components.stream().map(Heuristic::getName).collect(Collectors.joining(" + "));
    }

    @Override
    public int estimate(RegionGraph graph) {
        int best = 0;
        for (Heuristic component : components) {
            best = Math.max(best, component.estimate(graph));
        }
        return best;
    }

    @Override
    public boolean isAdmissible() {
        for (Heuristic component : components) {
            if (!component.isAdmissible()) {
                return false;
            }
        }
        return true;
    }
}
