package com.kamisolver.generator;

import com.google.common.collect.ImmutableList;
import com.kamisolver.color.RegionColor;
import com.kamisolver.puzzle.Edge;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import static org.junit.Assert.*;

/**
 * Tests for the topology, coloring and candidate enumerators.
 */
public class EnumeratorTest {

    private PlanarityTester planarity;

    @Before
    public void setUp() {
        planarity = new PlanarityTester();
    }

    private static <T> List<T> drain(Iterator<T> iterator) {
        List<T> items = new ArrayList<>();
        while (iterator.hasNext()) {
            items.add(iterator.next());
        }
        return items;
    }

    private static List<Long> masks(List<Topology> topologies) {
        List<Long> masks = new ArrayList<>();
        for (Topology topology : topologies) {
            masks.add(topology.getMask());
        }
        return masks;
    }

    // ========================================================================
    // Topologies
    // ========================================================================

    @Test
    public void testPairsInLexicographicOrder() {
        assertEquals(ImmutableList.of(Edge.of(0, 1), Edge.of(0, 2), Edge.of(0, 3),
                Edge.of(1, 2), Edge.of(1, 3), Edge.of(2, 3)), TopologyEnumerator.pairs(4));
    }

    @Test
    public void testTopologyForMask() {
        Topology topology = new TopologyEnumerator(4, planarity).topology(0b100001L);

        assertEquals(4, topology.getNodeCount());
        assertEquals(0b100001L, topology.getMask());
        assertEquals(ImmutableList.of(Edge.of(0, 1), Edge.of(2, 3)), topology.getEdges().asList());
    }

    @Test
    public void testConnectedGraphCounts() {
        // Connected labeled graphs: 1, 1, 4, 38, 728; only K5 is non-planar among them
        assertEquals(1, drain(new TopologyEnumerator(1, planarity)).size());
        assertEquals(1, drain(new TopologyEnumerator(2, planarity)).size());
        assertEquals(4, drain(new TopologyEnumerator(3, planarity)).size());
        assertEquals(38, drain(new TopologyEnumerator(4, planarity)).size());
        assertEquals(727, drain(new TopologyEnumerator(5, planarity)).size());
    }

    @Test
    public void testTopologiesInIncreasingMaskOrder() {
        List<Long> masks = masks(drain(new TopologyEnumerator(4, planarity)));

        for (int i = 1; i < masks.size(); i++) {
            assertTrue(masks.get(i - 1) < masks.get(i));
        }
        assertEquals(64, new TopologyEnumerator(4, planarity).getTotalMasks());
    }

    @Test
    public void testShardsPartitionTheSequence() {
        List<Long> all = masks(drain(new TopologyEnumerator(4, planarity)));
        Set<Long> union = new HashSet<>();
        int total = 0;
        for (int shard = 0; shard < 3; shard++) {
            List<Long> part = masks(drain(new TopologyEnumerator(4, planarity, 0L, shard, 3)));
            for (long mask : part) {
                assertEquals(shard, mask % 3);
            }
            union.addAll(part);
            total += part.size();
        }

        assertEquals(all.size(), total);
        assertEquals(new HashSet<>(all), union);
    }

    @Test
    public void testResumeFromMask() {
        List<Long> all = masks(drain(new TopologyEnumerator(4, planarity)));
        TopologyEnumerator first = new TopologyEnumerator(4, planarity);
        for (int i = 0; i < 10; i++) {
            first.next();
        }

        List<Long> rest = masks(drain(new TopologyEnumerator(4, planarity, first.getResumeMask(), 0, 1)));

        assertEquals(all.subList(10, all.size()), rest);
    }

    @Test
    public void testScannedCountIncludesRejectedMasks() {
        TopologyEnumerator topologies = new TopologyEnumerator(3, planarity);
        drain(topologies);

        assertEquals(8, topologies.getScannedCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTooManyNodesRejected() {
        new TopologyEnumerator(TopologyEnumerator.MAX_NODES + 1, planarity);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidShardRejected() {
        new TopologyEnumerator(4, planarity, 0L, 3, 3);
    }

    @Test(expected = NoSuchElementException.class)
    public void testNextPastEndThrows() {
        TopologyEnumerator topologies = new TopologyEnumerator(2, planarity);
        topologies.next();
        topologies.next();
    }

    // ========================================================================
    // Colorings
    // ========================================================================

    @Test
    public void testColoringCountsAreStirlingNumbers() {
        assertEquals(1, drain(new ColoringEnumerator(4, 1)).size());
        assertEquals(3, drain(new ColoringEnumerator(3, 2)).size());
        assertEquals(7, drain(new ColoringEnumerator(4, 2)).size());
        assertEquals(10, drain(new ColoringEnumerator(5, 4)).size());
        assertEquals(25, drain(new ColoringEnumerator(5, 3)).size());
        assertEquals(90, drain(new ColoringEnumerator(6, 3)).size());
        assertEquals(1, drain(new ColoringEnumerator(5, 5)).size());
    }

    @Test
    public void testColoringsAreRestrictedGrowthStringsInOrder() {
        List<ImmutableList<RegionColor>> colorings = drain(new ColoringEnumerator(3, 2));

        assertEquals(ImmutableList.of(
                ImmutableList.of(RegionColor.of(0), RegionColor.of(0), RegionColor.of(1)),
                ImmutableList.of(RegionColor.of(0), RegionColor.of(1), RegionColor.of(0)),
                ImmutableList.of(RegionColor.of(0), RegionColor.of(1), RegionColor.of(1))), colorings);
    }

    @Test
    public void testEveryColoringUsesExactlyKColors() {
        for (ImmutableList<RegionColor> coloring : drain(new ColoringEnumerator(6, 4))) {
            assertEquals(4, new HashSet<>(coloring).size());
            assertEquals(RegionColor.ORANGE, coloring.get(0));
        }
    }

    @Test
    public void testSynthesizedColorsPastPalette() {
        ImmutableList<RegionColor> only = new ColoringEnumerator(6, 6).next();

        assertEquals("COLOR_5", only.get(5).getName());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMoreColorsThanRegionsRejected() {
        new ColoringEnumerator(3, 4);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroColorsRejected() {
        new ColoringEnumerator(3, 0);
    }

    // ========================================================================
    // Candidates
    // ========================================================================

    @Test
    public void testCandidateProduct() {
        CandidateSequence candidates = new CandidateSequence(4, 2, planarity);
        List<PuzzleCandidate> all = drain(candidates);

        assertEquals(38 * 7, all.size());
        assertEquals(38, candidates.getTopologyCount());
        for (int i = 1; i < all.size(); i++) {
            assertTrue(all.get(i - 1).compareTo(all.get(i)) < 0);
        }
        assertEquals(0, all.get(0).getColoringIndex());
        assertEquals(6, all.get(6).getColoringIndex());
        assertEquals(0, all.get(7).getColoringIndex());
    }

    @Test
    public void testCandidateResume() {
        CandidateSequence full = new CandidateSequence(4, 3, planarity);
        List<PuzzleCandidate> all = drain(full);

        CandidateSequence partial = new CandidateSequence(4, 3, planarity);
        for (int i = 0; i < 20; i++) {
            partial.next();
        }
        long resumeMask = partial.getResumeMask();
        List<PuzzleCandidate> resumed = drain(CandidateSequence.startingAt(4, 3, planarity, resumeMask));

        // The resumed run replays the colorings of the interrupted topology
        assertEquals(resumeMask, resumed.get(0).getTopology().getMask());
        assertEquals(0, resumed.get(0).getColoringIndex());
        assertEquals(all.get(all.size() - 1), resumed.get(resumed.size() - 1));
        assertTrue(resumed.size() >= all.size() - 20);
    }

    @Test
    public void testCandidateToGraphCollapses() {
        // Path 0-1-2 colored 0,0,1 collapses to two regions
        Topology path = new TopologyEnumerator(3, planarity).topology(0b101L);
        PuzzleCandidate candidate = new PuzzleCandidate(path, 0,
                ImmutableList.of(RegionColor.of(0), RegionColor.of(0), RegionColor.of(1)));

        assertEquals(2, candidate.toGraph().size());
    }
}
