package com.kamisolver.puzzle;

import com.google.common.collect.ImmutableSortedSet;
import com.kamisolver.color.RegionColor;
import lombok.Value;

/**
 * A single region of a puzzle: its id, color and the ids of the regions it touches.
 */
@Value
public class RegionNode {

    int id;
    RegionColor color;
    ImmutableSortedSet<Integer> neighbors;

    public int getDegree() {
        return neighbors.size();
    }

    public boolean isAdjacentTo(int otherId) {
        return neighbors.contains(otherId);
    }

    RegionNode withColor(RegionColor newColor) {
        return new RegionNode(id, newColor, neighbors);
    }
}
