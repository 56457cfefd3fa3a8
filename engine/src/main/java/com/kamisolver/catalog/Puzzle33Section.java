package com.kamisolver.catalog;

import com.kamisolver.color.RegionColor;

/**
 * Regions of Kami level 3-3, top to bottom, with their starting colors.
 */
public enum Puzzle33Section {

    TOP_CREAM(0, RegionColor.CREAM),
    TOP_TURQUOISE(1, RegionColor.TURQUOISE),
    TOP_LEFT_ORANGE(2, RegionColor.ORANGE),
    MIDDLE_DARK_BLUE(3, RegionColor.DARK_BLUE),
    TOP_RIGHT_ORANGE(4, RegionColor.ORANGE),
    MIDDLE_LEFT_CREAM(5, RegionColor.CREAM),
    MIDDLE_RIGHT_CREAM(6, RegionColor.CREAM),
    BOTTOM_LEFT_ORANGE(7, RegionColor.ORANGE),
    BOTTOM_RIGHT_ORANGE(8, RegionColor.ORANGE),
    BOTTOM_TURQUOISE(9, RegionColor.TURQUOISE),
    BOTTOM_CREAM(10, RegionColor.CREAM);

    private final int id;
    private final RegionColor color;

    Puzzle33Section(int id, RegionColor color) {
        this.id = id;
        this.color = color;
    }

    public int getId() {
        return id;
    }

    public RegionColor getColor() {
        return color;
    }

    /**
     * Look up a section by region id.
     *
     * @throws IllegalArgumentException if no section has that id
     */
    public static Puzzle33Section fromId(int id) {
        for (Puzzle33Section section : values()) {
            if (section.id == id) {
                return section;
            }
        }
        throw new IllegalArgumentException("No 3-3 section with id " + id);
    }
}
