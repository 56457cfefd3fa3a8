package com.kamisolver.generator;

import com.google.common.collect.ImmutableSortedSet;
import com.kamisolver.puzzle.Edge;
import lombok.Value;

/**
 * A labeled graph on {@code 0..nodeCount-1}, identified by its edge bitmask.
 * Bit {@code i} of the mask selects the {@code i}-th pair in lexicographic order.
 */
@Value
public class Topology {

    int nodeCount;
    long mask;
    ImmutableSortedSet<Edge> edges;
}
