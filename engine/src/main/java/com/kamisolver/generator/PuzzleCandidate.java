package com.kamisolver.generator;

import com.google.common.collect.ImmutableList;
import com.kamisolver.color.RegionColor;
import com.kamisolver.puzzle.RegionGraph;
import com.kamisolver.puzzle.RegionGraphs;
import lombok.Value;

import java.util.HashMap;
import java.util.Map;

/**
 * One generated instance: a topology plus an initial coloring, with its enumeration position.
 */
@Value
public class PuzzleCandidate implements Comparable<PuzzleCandidate> {

    Topology topology;

    /**
     * Index of the coloring among the colorings enumerated for this topology.
     */
    int coloringIndex;

    /**
     * Color of region {@code i} at position {@code i}.
     */
    ImmutableList<RegionColor> coloring;

    /**
     * Build the (collapsed) puzzle this candidate describes.
     */
    public RegionGraph toGraph() {
        Map<Integer, RegionColor> colors = new HashMap<>();
        for (int i = 0; i < coloring.size(); i++) {
            colors.put(i, coloring.get(i));
        }
        return RegionGraphs.build(topology.getNodeCount(), topology.getEdges(), colors);
    }

    /**
     * Order of enumeration: by topology mask, then coloring index.
     */
    @Override
    public int compareTo(PuzzleCandidate other) {
        int c = Long.compare(topology.getMask(), other.topology.getMask());
        return c != 0 ? c : Integer.compare(coloringIndex, other.coloringIndex);
    }
}
