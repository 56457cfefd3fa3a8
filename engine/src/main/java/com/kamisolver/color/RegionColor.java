package com.kamisolver.color;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Color of a puzzle region.
 *
 * <p>Colors form an unbounded, totally ordered domain indexed from zero:
 * <ul>
 *   <li>Indices 0-3 are the named colors of the original game palette</li>
 *   <li>Every index from 4 upwards is a synthesized color named {@code COLOR_<index>}</li>
 * </ul>
 *
 * <p>Equality, hashing and ordering are by index only, so a color minted twice for
 * the same index is indistinguishable from the first one.
 */
public final class RegionColor implements Comparable<RegionColor> {

    public static final RegionColor ORANGE = new RegionColor(0, "ORANGE");
    public static final RegionColor DARK_BLUE = new RegionColor(1, "DARK_BLUE");
    public static final RegionColor CREAM = new RegionColor(2, "CREAM");
    public static final RegionColor TURQUOISE = new RegionColor(3, "TURQUOISE");

    private static final RegionColor[] NAMED = {ORANGE, DARK_BLUE, CREAM, TURQUOISE};

    /**
     * Prefix used for synthesized color names.
     */
    public static final String SYNTHESIZED_PREFIX = "COLOR_";

    private final int index;
    private final String name;

    private RegionColor(int index, String name) {
        this.index = index;
        this.name = name;
    }

    /**
     * Get the color for an index, minting a synthesized one past the named palette.
     *
     * @param index the color index (0 or greater)
     * @return the color at that index
     * @throws IllegalArgumentException if the index is negative
     */
    public static RegionColor of(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Color index must be non-negative: " + index);
        }
        if (index < NAMED.length) {
            return NAMED[index];
        }
        return new RegionColor(index, SYNTHESIZED_PREFIX + index);
    }

    /**
     * Get the first {@code count} colors in index order.
     *
     * @param count number of colors
     * @return unmodifiable list of colors 0..count-1
     */
    public static List<RegionColor> palette(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Palette size must be non-negative: " + count);
        }
        List<RegionColor> colors = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            colors.add(of(i));
        }
        return Collections.unmodifiableList(colors);
    }

    /**
     * Number of colors that carry a game palette name.
     */
    public static int namedCount() {
        return NAMED.length;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public boolean isNamed() {
        return index < NAMED.length;
    }

    @Override
    public int compareTo(RegionColor other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return index == ((RegionColor) o).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public String toString() {
        return name;
    }
}
