package com.kamisolver.puzzle;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.kamisolver.color.RegionColor;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable snapshot of a puzzle: the live regions keyed by id.
 *
 * <p>Every transition produces a new graph, so a snapshot held by a search state is never
 * changed behind its back. A graph obtained from {@link RegionGraphs} or from
 * {@link MoveApplicator} is always collapsed: no two adjacent live regions share a color.
 *
 * <p>Two graphs are equal when they hold the same ids with the same colors and neighbors.
 * Equality is by label; structural equivalence is the job of the signature package.
 */
public final class RegionGraph {

    private final ImmutableSortedMap<Integer, RegionNode> nodes;

    RegionGraph(ImmutableSortedMap<Integer, RegionNode> nodes) {
        this.nodes = nodes;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * A puzzle is solved once a single region remains.
     */
    public boolean isSolved() {
        return nodes.size() == 1;
    }

    public Set<Integer> getLiveIds() {
        return nodes.keySet();
    }

    public Collection<RegionNode> getNodes() {
        return nodes.values();
    }

    public boolean contains(int id) {
        return nodes.containsKey(id);
    }

    public Optional<RegionNode> findNode(int id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * Get a live region.
     *
     * @throws IllegalArgumentException if the id is not live
     */
    public RegionNode getNode(int id) {
        RegionNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("No live region with id " + id);
        }
        return node;
    }

    public RegionColor getColor(int id) {
        return getNode(id).getColor();
    }

    /**
     * Distinct colors present among live regions, in index order.
     */
    public Set<RegionColor> getColors() {
        TreeSet<RegionColor> colors = new TreeSet<>();
        for (RegionNode node : nodes.values()) {
            colors.add(node.getColor());
        }
        return ImmutableSortedSet.copyOfSorted(colors);
    }

    public int getEdgeCount() {
        int degreeSum = 0;
        for (RegionNode node : nodes.values()) {
            degreeSum += node.getDegree();
        }
        return degreeSum / 2;
    }

    public Set<Edge> getEdges() {
        ImmutableSortedSet.Builder<Edge> edges = ImmutableSortedSet.naturalOrder();
        for (RegionNode node : nodes.values()) {
            for (int neighbor : node.getNeighbors()) {
                if (node.getId() < neighbor) {
                    edges.add(Edge.of(node.getId(), neighbor));
                }
            }
        }
        return edges.build();
    }

    /**
     * Check the post-collapse invariant: no live adjacent pair shares a color.
     */
    public boolean isCollapsed() {
        for (RegionNode node : nodes.values()) {
            for (int neighbor : node.getNeighbors()) {
                if (nodes.get(neighbor).getColor().equals(node.getColor())) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Recolor one region without merging. The result may hold adjacent same-colored regions
     * until it is collapsed.
     */
    RegionGraph withColor(int id, RegionColor color) {
        RegionNode node = getNode(id);
        ImmutableSortedMap.Builder<Integer, RegionNode> builder = ImmutableSortedMap.naturalOrder();
        for (RegionNode other : nodes.values()) {
            builder.put(other.getId(), other.getId() == id ? node.withColor(color) : other);
        }
        return new RegionGraph(builder.build());
    }

    /**
     * Merge every same-colored connected component into a single region.
     * The lowest id of each component survives.
     *
     * @return the collapsed graph, or this graph if nothing needed merging
     */
    public RegionGraph collapse() {
        Map<Integer, Integer> survivorOf = new HashMap<>();
        boolean merged = false;
        for (int id : nodes.keySet()) {
            if (survivorOf.containsKey(id)) {
                continue;
            }
            Set<Integer> component = sameColorComponent(id);
            for (int member : component) {
                survivorOf.put(member, id);
            }
            merged |= component.size() > 1;
        }
        return merged ? merge(survivorOf) : this;
    }

    /**
     * Merge the same-colored component containing {@code id} into that region.
     *
     * <p>The component is found by a walk over the induced same-color subgraph, so regions
     * that only become reachable through other absorbed regions are merged too.
     *
     * @return the collapsed graph, or this graph if the region has no same-colored neighbor
     */
    public RegionGraph collapseAround(int id) {
        Set<Integer> component = sameColorComponent(id);
        if (component.size() == 1) {
            return this;
        }
        Map<Integer, Integer> survivorOf = new HashMap<>();
        for (int member : component) {
            survivorOf.put(member, id);
        }
        return merge(survivorOf);
    }

    private Set<Integer> sameColorComponent(int start) {
        RegionColor color = getColor(start);
        Set<Integer> component = new HashSet<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            if (!component.add(current)) {
                continue;
            }
            for (int neighbor : nodes.get(current).getNeighbors()) {
                if (!component.contains(neighbor) && nodes.get(neighbor).getColor().equals(color)) {
                    stack.push(neighbor);
                }
            }
        }
        return component;
    }

    /**
     * Rebuild the graph with every id mapped to its survivor. Ids missing from the map
     * survive as themselves.
     */
    private RegionGraph merge(Map<Integer, Integer> survivorOf) {
        Map<Integer, TreeSet<Integer>> neighborsOf = new HashMap<>();
        for (RegionNode node : nodes.values()) {
            int survivor = survivorOf.getOrDefault(node.getId(), node.getId());
            TreeSet<Integer> merged = neighborsOf.computeIfAbsent(survivor, k -> new TreeSet<>());
            for (int neighbor : node.getNeighbors()) {
                int target = survivorOf.getOrDefault(neighbor, neighbor);
                if (target != survivor) {
                    merged.add(target);
                }
            }
        }

        ImmutableSortedMap.Builder<Integer, RegionNode> builder = ImmutableSortedMap.naturalOrder();
        for (Map.Entry<Integer, TreeSet<Integer>> entry : neighborsOf.entrySet()) {
            int id = entry.getKey();
            builder.put(id, new RegionNode(id, nodes.get(id).getColor(),
                    ImmutableSortedSet.copyOfSorted(entry.getValue())));
        }
        return new RegionGraph(builder.build());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return nodes.equals(((RegionGraph) o).nodes);
    }

    @Override
    public int hashCode() {
        return nodes.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RegionGraph{");
        boolean first = true;
        for (RegionNode node : nodes.values()) {
            if (!first) sb.append(", ");
            sb.append(node.getId()).append(':').append(node.getColor()).append(node.getNeighbors());
            first = false;
        }
        return sb.append('}').toString();
    }
}
