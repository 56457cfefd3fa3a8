package com.kamisolver.puzzle;

import com.kamisolver.color.RegionColor;
import lombok.extern.slf4j.Slf4j;

import javax.inject.Inject;
import javax.inject.Singleton;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies moves to puzzles and enumerates the moves available from a state.
 *
 * <p>This is the only place a {@link RegionGraph} transitions: the target region is
 * recolored and then collapsed into every region it now reaches through its new color.
 * Stateless and safe to share.
 */
@Slf4j
@Singleton
public class MoveApplicator {

    @Inject
    public MoveApplicator() {
    }

    /**
     * Apply a move and return the resulting puzzle.
     *
     * @param graph the current puzzle (left unchanged)
     * @param move  the move to apply
     * @return the collapsed puzzle after the move
     * @throws InvalidMoveException if the target is not live or already has that color
     */
    public RegionGraph apply(RegionGraph graph, Move move) {
        validate(graph, move);
        return graph.withColor(move.getTargetId(), move.getColor())
                .collapseAround(move.getTargetId());
    }

    /**
     * Check that a move can be applied to a puzzle.
     *
     * @throws InvalidMoveException if the target is not live or already has that color
     */
    public void validate(RegionGraph graph, Move move) {
        if (move == null || move.getColor() == null) {
            throw new IllegalArgumentException("Move and move color are required");
        }
        if (!graph.contains(move.getTargetId())) {
            throw new InvalidMoveException(move, "Unknown region");
        }
        if (graph.getColor(move.getTargetId()).equals(move.getColor())) {
            throw new InvalidMoveException(move, "Region already has that color");
        }
    }

    /**
     * Apply moves in order.
     *
     * @return the puzzle after the last move
     * @throws InvalidMoveException at the first move that cannot be applied
     */
    public RegionGraph replay(RegionGraph graph, List<Move> moves) {
        RegionGraph current = graph;
        for (Move move : moves) {
            current = apply(current, move);
        }
        log.debug("Replayed {} moves, {} regions remain", moves.size(), current.size());
        return current;
    }

    /**
     * Moves that recolor a region to the color of one of its neighbors, one per distinct
     * neighboring color, in region id order.
     */
    public List<Move> neighborColorMoves(RegionGraph graph) {
        List<Move> moves = new ArrayList<>();
        for (RegionNode node : graph.getNodes()) {
            Set<RegionColor> offered = new LinkedHashSet<>();
            for (int neighbor : node.getNeighbors()) {
                RegionColor color = graph.getColor(neighbor);
                if (!color.equals(node.getColor()) && offered.add(color)) {
                    moves.add(Move.of(node.getId(), color));
                }
            }
        }
        return moves;
    }

    /**
     * Moves that recolor any region to any palette color it does not already have.
     */
    public List<Move> paletteMoves(RegionGraph graph, Collection<RegionColor> palette) {
        List<Move> moves = new ArrayList<>();
        for (RegionNode node : graph.getNodes()) {
            for (RegionColor color : palette) {
                if (!color.equals(node.getColor())) {
                    moves.add(Move.of(node.getId(), color));
                }
            }
        }
        return moves;
    }

    /**
     * Moves available under the given generation policy.
     *
     * @param palette colors offered by {@link MoveGeneration#FULL_PALETTE}; ignored otherwise
     */
    public List<Move> validMoves(RegionGraph graph, MoveGeneration generation, Collection<RegionColor> palette) {
        switch (generation) {
            case FULL_PALETTE:
                return paletteMoves(graph, palette);
            case NEIGHBOR_COLORS:
            default:
                return neighborColorMoves(graph);
        }
    }
}
