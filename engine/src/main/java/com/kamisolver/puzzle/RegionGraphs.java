package com.kamisolver.puzzle;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.kamisolver.color.RegionColor;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Factory for {@link RegionGraph} instances from a puzzle description.
 *
 * <p>Descriptions are validated against the graph invariants and collapsed before they are
 * returned, so adjacent regions given the same initial color come back as one region.
 */
public final class RegionGraphs {

    private RegionGraphs() {
    }

    /**
     * Build a puzzle whose regions are numbered {@code 0..nodeCount-1}.
     *
     * @param nodeCount number of regions
     * @param adjacency unordered pairs of touching regions
     * @param coloring  initial color of every region
     * @return the collapsed puzzle
     * @throws MalformedGraphException if the description is invalid or disconnected
     */
    public static RegionGraph build(int nodeCount, Set<Edge> adjacency, Map<Integer, RegionColor> coloring) {
        if (nodeCount < 1) {
            throw new MalformedGraphException("A puzzle needs at least one region, got " + nodeCount);
        }
        if (adjacency == null || coloring == null) {
            throw new MalformedGraphException("Adjacency and coloring are required");
        }

        Map<Integer, TreeSet<Integer>> neighbors = new TreeMap<>();
        for (int id = 0; id < nodeCount; id++) {
            neighbors.put(id, new TreeSet<>());
        }
        for (Edge edge : adjacency) {
            if (edge.isSelfLoop()) {
                throw new MalformedGraphException("Region " + edge.getFirst() + " cannot touch itself");
            }
            if (!neighbors.containsKey(edge.getFirst()) || !neighbors.containsKey(edge.getSecond())) {
                throw new MalformedGraphException("Edge " + edge + " references an unknown region (ids are 0.."
                        + (nodeCount - 1) + ")");
            }
            neighbors.get(edge.getFirst()).add(edge.getSecond());
            neighbors.get(edge.getSecond()).add(edge.getFirst());
        }
        return assemble(neighbors, coloring);
    }

    /**
     * Build a puzzle from a per-region list of touching regions, as a captured board
     * describes it. Ids may be any integers but every listed neighbor must list the region back.
     *
     * @param coloring initial color of every region; its keys define the region ids
     * @param touching neighbors of each region (regions may be omitted when they touch nothing)
     * @return the collapsed puzzle
     * @throws MalformedGraphException if adjacency is asymmetric, references unknown ids,
     *                                 contains self adjacency or leaves the puzzle disconnected
     */
    public static RegionGraph fromNeighborMap(Map<Integer, RegionColor> coloring,
                                              Map<Integer, ? extends Collection<Integer>> touching) {
        if (coloring == null || coloring.isEmpty()) {
            throw new MalformedGraphException("A puzzle needs at least one colored region");
        }
        Map<Integer, TreeSet<Integer>> neighbors = new TreeMap<>();
        for (int id : coloring.keySet()) {
            neighbors.put(id, new TreeSet<>());
        }
        for (Map.Entry<Integer, ? extends Collection<Integer>> entry : touching.entrySet()) {
            int id = entry.getKey();
            if (!neighbors.containsKey(id)) {
                throw new MalformedGraphException("Adjacency lists unknown region " + id);
            }
            for (int neighbor : entry.getValue()) {
                if (neighbor == id) {
                    throw new MalformedGraphException("Region " + id + " cannot touch itself");
                }
                if (!neighbors.containsKey(neighbor)) {
                    throw new MalformedGraphException("Region " + id + " touches unknown region " + neighbor);
                }
                neighbors.get(id).add(neighbor);
            }
        }
        for (Map.Entry<Integer, TreeSet<Integer>> entry : neighbors.entrySet()) {
            for (int neighbor : entry.getValue()) {
                if (!neighbors.get(neighbor).contains(entry.getKey())) {
                    throw new MalformedGraphException("Adjacency is not symmetric: " + entry.getKey()
                            + " touches " + neighbor + " but not the other way round");
                }
            }
        }
        return assemble(neighbors, coloring);
    }

    private static RegionGraph assemble(Map<Integer, TreeSet<Integer>> neighbors, Map<Integer, RegionColor> coloring) {
        for (int id : coloring.keySet()) {
            if (!neighbors.containsKey(id)) {
                throw new MalformedGraphException("Coloring references unknown region " + id);
            }
        }

        ImmutableSortedMap.Builder<Integer, RegionNode> builder = ImmutableSortedMap.naturalOrder();
        for (Map.Entry<Integer, TreeSet<Integer>> entry : neighbors.entrySet()) {
            RegionColor color = coloring.get(entry.getKey());
            if (color == null) {
                throw new MalformedGraphException("Region " + entry.getKey() + " has no color");
            }
            builder.put(entry.getKey(), new RegionNode(entry.getKey(), color,
                    ImmutableSortedSet.copyOfSorted(entry.getValue())));
        }

        if (!isConnected(neighbors)) {
            throw new MalformedGraphException("Puzzle regions must form a single connected area");
        }
        return new RegionGraph(builder.build()).collapse();
    }

    static boolean isConnected(Map<Integer, ? extends Collection<Integer>> neighbors) {
        if (neighbors.isEmpty()) {
            return true;
        }
        int start = neighbors.keySet().iterator().next();
        Set<Integer> seen = new HashSet<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            if (seen.add(current)) {
                for (int next : neighbors.get(current)) {
                    if (!seen.contains(next)) {
                        stack.push(next);
                    }
                }
            }
        }
        return seen.size() == neighbors.size();
    }
}
