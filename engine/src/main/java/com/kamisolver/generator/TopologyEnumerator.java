package com.kamisolver.generator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.kamisolver.puzzle.Edge;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazily enumerates the connected planar graphs on {@code n} labeled vertices.
 *
 * <p>Every subset of the {@code n(n-1)/2} vertex pairs is visited in increasing bitmask order;
 * only the current mask is held in memory. An enumerator can start at any mask, which makes
 * a run restartable, and can be restricted to one shard of the masks
 * ({@code mask % shardCount == shardIndex}) for parallel workers.
 */
public class TopologyEnumerator implements Iterator<Topology> {

    /**
     * Masks are held in a long; 8 vertices already give 2^28 candidates.
     */
    public static final int MAX_NODES = 8;

    private final int nodeCount;
    private final PlanarityTester planarity;
    private final ImmutableList<Edge> pairs;
    private final long endMask;
    private final int shardCount;

    private long nextMask;
    private Topology pending;
    private long scanned;

    public TopologyEnumerator(int nodeCount, PlanarityTester planarity) {
        this(nodeCount, planarity, 0L, 0, 1);
    }

    /**
     * @param startMask  first mask to consider
     * @param shardIndex which residue class of masks this enumerator visits
     * @param shardCount number of shards
     */
    public TopologyEnumerator(int nodeCount, PlanarityTester planarity, long startMask, int shardIndex, int shardCount) {
        if (nodeCount < 1 || nodeCount > MAX_NODES) {
            throw new IllegalArgumentException("Node count must be between 1 and " + MAX_NODES + ", got " + nodeCount);
        }
        if (shardCount < 1 || shardIndex < 0 || shardIndex >= shardCount) {
            throw new IllegalArgumentException("Invalid shard " + shardIndex + " of " + shardCount);
        }
        this.nodeCount = nodeCount;
        this.planarity = planarity;
        this.pairs = pairs(nodeCount);
        this.endMask = 1L << pairs.size();
        this.shardCount = shardCount;

        long first = Math.max(0L, startMask);
        long offset = Math.floorMod(shardIndex - first, (long) shardCount);
        this.nextMask = first + offset;
    }

    /**
     * All vertex pairs in lexicographic order; pair {@code i} is bit {@code i} of a mask.
     */
    public static ImmutableList<Edge> pairs(int nodeCount) {
        ImmutableList.Builder<Edge> builder = ImmutableList.builder();
        for (int a = 0; a < nodeCount; a++) {
            for (int b = a + 1; b < nodeCount; b++) {
                builder.add(Edge.of(a, b));
            }
        }
        return builder.build();
    }

    /**
     * Build the topology for a mask without filtering.
     */
    public Topology topology(long mask) {
        ImmutableSortedSet.Builder<Edge> edges = ImmutableSortedSet.naturalOrder();
        for (int i = 0; i < pairs.size(); i++) {
            if ((mask & (1L << i)) != 0) {
                edges.add(pairs.get(i));
            }
        }
        return new Topology(nodeCount, mask, edges.build());
    }

    @Override
    public boolean hasNext() {
        while (pending == null && nextMask < endMask) {
            long mask = nextMask;
            nextMask += shardCount;
            scanned++;
            Topology candidate = topology(mask);
            if (isConnected(candidate) && planarity.isPlanar(nodeCount, candidate.getEdges())) {
                pending = candidate;
            }
        }
        return pending != null;
    }

    @Override
    public Topology next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Topology result = pending;
        pending = null;
        return result;
    }

    /**
     * Next mask this enumerator would examine; a new enumerator started there resumes the run.
     */
    public long getResumeMask() {
        return pending != null ? pending.getMask() : nextMask;
    }

    /**
     * Masks examined so far, kept or not.
     */
    public long getScannedCount() {
        return scanned;
    }

    public long getTotalMasks() {
        return endMask;
    }

    private boolean isConnected(Topology topology) {
        if (nodeCount == 1) {
            return true;
        }
        if (topology.getEdges().size() < nodeCount - 1) {
            return false;
        }
        List<Edge> edges = topology.getEdges().asList();
        boolean[] seen = new boolean[nodeCount];
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(0);
        seen[0] = true;
        int reached = 1;
        while (!stack.isEmpty()) {
            int v = stack.pop();
            for (Edge edge : edges) {
                if (edge.touches(v)) {
                    int w = edge.other(v);
                    if (!seen[w]) {
                        seen[w] = true;
                        reached++;
                        stack.push(w);
                    }
                }
            }
        }
        return reached == nodeCount;
    }
}
