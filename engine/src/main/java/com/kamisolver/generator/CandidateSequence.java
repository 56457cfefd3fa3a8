package com.kamisolver.generator;

import com.google.common.collect.ImmutableList;
import com.kamisolver.color.RegionColor;
import lombok.Getter;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy product of topologies and colorings.
 *
 * <p>Only the current topology and the current coloring are held, so memory does not grow
 * with the size of the space. Use {@link #getResumeMask()} and {@link #startingAt} to resume
 * an interrupted run at the topology it stopped in.
 */
public class CandidateSequence implements Iterator<PuzzleCandidate> {

    private final TopologyEnumerator topologies;
    private final int nodeCount;
    private final int colorCount;

    private Topology topology;
    private ColoringEnumerator colorings;
    private int coloringIndex;

    @Getter
    private long topologyCount;

    public CandidateSequence(int nodeCount, int colorCount, PlanarityTester planarity) {
        this(new TopologyEnumerator(nodeCount, planarity), nodeCount, colorCount);
    }

    public CandidateSequence(TopologyEnumerator topologies, int nodeCount, int colorCount) {
        if (colorCount < 1 || colorCount > nodeCount) {
            throw new IllegalArgumentException("Color count must be between 1 and " + nodeCount + ", got " + colorCount);
        }
        this.topologies = topologies;
        this.nodeCount = nodeCount;
        this.colorCount = colorCount;
    }

    /**
     * A sequence that skips every topology with a smaller mask.
     */
    public static CandidateSequence startingAt(int nodeCount, int colorCount, PlanarityTester planarity, long mask) {
        return new CandidateSequence(new TopologyEnumerator(nodeCount, planarity, mask, 0, 1), nodeCount, colorCount);
    }

    @Override
    public boolean hasNext() {
        while (colorings == null || !colorings.hasNext()) {
            if (!topologies.hasNext()) {
                return false;
            }
            topology = topologies.next();
            topologyCount++;
            colorings = new ColoringEnumerator(nodeCount, colorCount);
            coloringIndex = 0;
        }
        return true;
    }

    @Override
    public PuzzleCandidate next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ImmutableList<RegionColor> coloring = colorings.next();
        return new PuzzleCandidate(topology, coloringIndex++, coloring);
    }

    /**
     * Mask of the topology currently being colored, or of the next one if none is.
     * Restarting there replays at most one topology's colorings.
     */
    public long getResumeMask() {
        if (topology != null && colorings != null && colorings.hasNext()) {
            return topology.getMask();
        }
        return topologies.getResumeMask();
    }

    public TopologyEnumerator getTopologies() {
        return topologies;
    }
}
