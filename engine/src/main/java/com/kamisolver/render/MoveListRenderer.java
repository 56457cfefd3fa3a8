package com.kamisolver.render;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.kamisolver.color.RegionColor;
import com.kamisolver.generator.HardestPuzzleRecord;
import com.kamisolver.puzzle.Edge;
import com.kamisolver.puzzle.Move;
import com.kamisolver.puzzle.RegionGraph;
import com.kamisolver.puzzle.RegionNode;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Text and JSON renderings of puzzles, move lists and generator records.
 */
@Singleton
public class MoveListRenderer {

    private final Gson gson;

    @Inject
    public MoveListRenderer() {
        this(new GsonBuilder().setPrettyPrinting().create());
    }

    public MoveListRenderer(Gson gson) {
        this.gson = gson;
    }

    /**
     * One numbered line per move: {@code 1. Set node 3 to CREAM}.
     */
    public String renderMoves(List<Move> moves) {
        return renderMoves(moves, id -> "node " + id);
    }

    /**
     * Numbered move lines with a custom region naming, e.g. section names of a captured board.
     */
    public String renderMoves(List<Move> moves, IntFunction<String> regionName) {
        if (moves.isEmpty()) {
            return "Already solved.";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < moves.size(); i++) {
            Move move = moves.get(i);
            sb.append(i + 1).append(". Set ")
                    .append(regionName.apply(move.getTargetId()))
                    .append(" to ").append(move.getColor().getName());
            if (i + 1 < moves.size()) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * One line per live region: {@code Node 0: Color ORANGE, Neighbors [1, 2]}.
     */
    public String renderGraph(RegionGraph graph) {
        StringBuilder sb = new StringBuilder();
        for (RegionNode node : graph.getNodes()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("Node ").append(node.getId())
                    .append(": Color ").append(node.getColor().getName())
                    .append(", Neighbors ").append(node.getNeighbors());
        }
        return sb.toString();
    }

    public JsonObject toJsonTree(HardestPuzzleRecord record) {
        JsonObject json = new JsonObject();
        json.addProperty("moveCount", record.getMoveCount());
        json.addProperty("topologyMask", record.getCandidate().getTopology().getMask());
        json.addProperty("coloringIndex", record.getCandidate().getColoringIndex());

        JsonArray edges = new JsonArray();
        for (Edge edge : record.getCandidate().getTopology().getEdges()) {
            JsonArray pair = new JsonArray();
            pair.add(edge.getFirst());
            pair.add(edge.getSecond());
            edges.add(pair);
        }
        json.add("edges", edges);

        JsonArray coloring = new JsonArray();
        for (RegionColor color : record.getCandidate().getColoring()) {
            coloring.add(color.getName());
        }
        json.add("coloring", coloring);
        json.add("puzzle", toJsonTree(record.getPuzzle()));

        JsonArray solution = new JsonArray();
        for (Move move : record.getSolution()) {
            JsonObject step = new JsonObject();
            step.addProperty("node", move.getTargetId());
            step.addProperty("color", move.getColor().getName());
            solution.add(step);
        }
        json.add("solution", solution);
        return json;
    }

    public JsonObject toJsonTree(RegionGraph graph) {
        JsonObject regions = new JsonObject();
        for (RegionNode node : graph.getNodes()) {
            JsonObject region = new JsonObject();
            region.addProperty("color", node.getColor().getName());
            JsonArray neighbors = new JsonArray();
            node.getNeighbors().forEach(neighbors::add);
            region.add("neighbors", neighbors);
            regions.add(String.valueOf(node.getId()), region);
        }
        return regions;
    }

    public String toJson(HardestPuzzleRecord record) {
        return gson.toJson(toJsonTree(record));
    }
}
