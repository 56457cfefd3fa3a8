package com.kamisolver.generator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.kamisolver.color.RegionColor;
import com.kamisolver.puzzle.Edge;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class BestRecordTrackerTest {

    private BestRecordTracker tracker;

    @Before
    public void setUp() {
        tracker = new BestRecordTracker();
    }

    private static HardestPuzzleRecord record(long mask, int coloringIndex, int moveCount) {
        Topology topology = new Topology(2, mask, ImmutableSortedSet.of(Edge.of(0, 1)));
        PuzzleCandidate candidate = new PuzzleCandidate(topology, coloringIndex,
                ImmutableList.of(RegionColor.ORANGE, RegionColor.DARK_BLUE));
        return HardestPuzzleRecord.builder()
                .candidate(candidate)
                .puzzle(candidate.toGraph())
                .moveCount(moveCount)
                .build();
    }

    @Test
    public void testEmpty() {
        assertFalse(tracker.getBest().isPresent());
        assertEquals(-1, tracker.getBestMoveCount());
    }

    @Test
    public void testMoreMovesWins() {
        assertTrue(tracker.offer(record(5, 0, 2)));
        assertTrue(tracker.offer(record(9, 0, 3)));
        assertFalse(tracker.offer(record(1, 0, 1)));

        assertEquals(3, tracker.getBestMoveCount());
        assertEquals(9, tracker.getBest().get().getCandidate().getTopology().getMask());
    }

    @Test
    public void testTieGoesToEarlierPosition() {
        tracker.offer(record(9, 2, 3));

        assertTrue(tracker.offer(record(9, 1, 3)));
        assertFalse(tracker.offer(record(12, 0, 3)));
        assertTrue(tracker.offer(record(4, 7, 3)));

        assertEquals(4, tracker.getBest().get().getCandidate().getTopology().getMask());
    }

    @Test
    public void testBeats() {
        assertTrue(record(1, 0, 0).beats(null));
        assertTrue(record(1, 0, 2).beats(record(0, 0, 1)));
        assertFalse(record(1, 0, 2).beats(record(0, 0, 2)));
    }
}
