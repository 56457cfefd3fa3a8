package com.kamisolver.catalog;

import com.kamisolver.color.RegionColor;
import com.kamisolver.puzzle.RegionGraph;
import com.kamisolver.puzzle.RegionGraphs;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.kamisolver.catalog.Puzzle33Section.*;

/**
 * Hand-captured levels of the original game.
 */
public final class SamplePuzzles {

    private static final Map<Puzzle33Section, Puzzle33Section[]> PUZZLE_33_TOUCHING = new EnumMap<>(Puzzle33Section.class);

    static {
        PUZZLE_33_TOUCHING.put(TOP_CREAM, new Puzzle33Section[]{TOP_TURQUOISE, TOP_LEFT_ORANGE, TOP_RIGHT_ORANGE});
        PUZZLE_33_TOUCHING.put(TOP_TURQUOISE, new Puzzle33Section[]{TOP_CREAM, MIDDLE_DARK_BLUE});
        PUZZLE_33_TOUCHING.put(TOP_LEFT_ORANGE, new Puzzle33Section[]{TOP_CREAM, MIDDLE_DARK_BLUE, MIDDLE_LEFT_CREAM});
        PUZZLE_33_TOUCHING.put(MIDDLE_DARK_BLUE, new Puzzle33Section[]{TOP_TURQUOISE, TOP_LEFT_ORANGE, TOP_RIGHT_ORANGE,
                MIDDLE_LEFT_CREAM, MIDDLE_RIGHT_CREAM, BOTTOM_LEFT_ORANGE, BOTTOM_RIGHT_ORANGE, BOTTOM_TURQUOISE});
        PUZZLE_33_TOUCHING.put(TOP_RIGHT_ORANGE, new Puzzle33Section[]{TOP_CREAM, MIDDLE_DARK_BLUE, MIDDLE_RIGHT_CREAM});
        PUZZLE_33_TOUCHING.put(MIDDLE_LEFT_CREAM, new Puzzle33Section[]{TOP_LEFT_ORANGE, MIDDLE_DARK_BLUE, BOTTOM_LEFT_ORANGE});
        PUZZLE_33_TOUCHING.put(MIDDLE_RIGHT_CREAM, new Puzzle33Section[]{TOP_RIGHT_ORANGE, MIDDLE_DARK_BLUE, BOTTOM_RIGHT_ORANGE});
        PUZZLE_33_TOUCHING.put(BOTTOM_LEFT_ORANGE, new Puzzle33Section[]{MIDDLE_LEFT_CREAM, MIDDLE_DARK_BLUE, BOTTOM_CREAM});
        PUZZLE_33_TOUCHING.put(BOTTOM_RIGHT_ORANGE, new Puzzle33Section[]{MIDDLE_RIGHT_CREAM, MIDDLE_DARK_BLUE, BOTTOM_CREAM});
        PUZZLE_33_TOUCHING.put(BOTTOM_TURQUOISE, new Puzzle33Section[]{MIDDLE_DARK_BLUE, BOTTOM_CREAM});
        PUZZLE_33_TOUCHING.put(BOTTOM_CREAM, new Puzzle33Section[]{BOTTOM_LEFT_ORANGE, BOTTOM_RIGHT_ORANGE, BOTTOM_TURQUOISE});
    }

    private SamplePuzzles() {
    }

    /**
     * Level 3-3: eleven regions in four colors, solvable in three moves.
     */
    public static RegionGraph puzzle33() {
        Map<Integer, RegionColor> coloring = new HashMap<>();
        Map<Integer, List<Integer>> touching = new HashMap<>();
        for (Puzzle33Section section : Puzzle33Section.values()) {
            coloring.put(section.getId(), section.getColor());
            List<Integer> neighbors = new ArrayList<>();
            for (Puzzle33Section neighbor : PUZZLE_33_TOUCHING.get(section)) {
                neighbors.add(neighbor.getId());
            }
            touching.put(section.getId(), neighbors);
        }
        return RegionGraphs.fromNeighborMap(coloring, touching);
    }

    /**
     * Display name of a 3-3 region for move listings.
     */
    public static String puzzle33SectionName(int id) {
        return Puzzle33Section.fromId(id).name();
    }
}
