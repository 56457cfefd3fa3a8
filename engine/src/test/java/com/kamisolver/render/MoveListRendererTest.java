package com.kamisolver.render;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.kamisolver.color.RegionColor;
import com.kamisolver.generator.HardestPuzzleRecord;
import com.kamisolver.generator.PuzzleCandidate;
import com.kamisolver.generator.Topology;
import com.kamisolver.puzzle.Edge;
import com.kamisolver.puzzle.Move;
import org.junit.Before;
import org.junit.Test;

import static com.kamisolver.GraphFixtures.*;
import static org.junit.Assert.*;

public class MoveListRendererTest {

    private MoveListRenderer renderer;

    @Before
    public void setUp() {
        renderer = new MoveListRenderer();
    }

    @Test
    public void testRenderMoves() {
        String text = renderer.renderMoves(ImmutableList.of(
                Move.of(3, RegionColor.CREAM),
                Move.of(0, RegionColor.of(6))));

        assertEquals("1. Set node 3 to CREAM\n2. Set node 0 to COLOR_6", text);
    }

    @Test
    public void testRenderMoves_Empty() {
        assertEquals("Already solved.", renderer.renderMoves(ImmutableList.of()));
    }

    @Test
    public void testRenderMoves_CustomNames() {
        String text = renderer.renderMoves(ImmutableList.of(Move.of(1, RegionColor.ORANGE)), id -> "REGION_" + id);

        assertEquals("1. Set REGION_1 to ORANGE", text);
    }

    @Test
    public void testRenderGraph() {
        String text = renderer.renderGraph(path(0, 1, 2));

        assertEquals("Node 0: Color ORANGE, Neighbors [1]\n"
                + "Node 1: Color DARK_BLUE, Neighbors [0, 2]\n"
                + "Node 2: Color CREAM, Neighbors [1]", text);
    }

    @Test
    public void testRecordJson() {
        Topology topology = new Topology(3, 0b011L, ImmutableSortedSet.of(Edge.of(0, 1), Edge.of(0, 2)));
        PuzzleCandidate candidate = new PuzzleCandidate(topology, 0,
                ImmutableList.of(RegionColor.ORANGE, RegionColor.DARK_BLUE, RegionColor.CREAM));
        HardestPuzzleRecord record = HardestPuzzleRecord.builder()
                .candidate(candidate)
                .puzzle(candidate.toGraph())
                .moveCount(2)
                .solution(ImmutableList.of(Move.of(0, RegionColor.DARK_BLUE), Move.of(0, RegionColor.CREAM)))
                .build();

        JsonObject json = JsonParser.parseString(renderer.toJson(record)).getAsJsonObject();

        assertEquals(2, json.get("moveCount").getAsInt());
        assertEquals(3, json.get("topologyMask").getAsLong());
        assertEquals(2, json.getAsJsonArray("edges").size());
        assertEquals("CREAM", json.getAsJsonArray("coloring").get(2).getAsString());
        assertEquals(2, json.getAsJsonObject("puzzle").getAsJsonObject("0").getAsJsonArray("neighbors").size());
        assertEquals("DARK_BLUE", json.getAsJsonArray("solution").get(0).getAsJsonObject().get("color").getAsString());
        assertEquals(0, json.getAsJsonArray("solution").get(1).getAsJsonObject().get("node").getAsInt());
    }
}
