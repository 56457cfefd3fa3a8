package com.kamisolver.generator;

import com.google.common.collect.ImmutableList;
import com.kamisolver.color.RegionColor;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily enumerates the colorings of {@code n} regions that use exactly {@code k} colors,
 * one per class of colorings equivalent under renaming the colors.
 *
 * <p>Colorings are restricted growth strings in lexicographic order: region 0 takes color 0
 * and every later region takes a color already used or the lowest unused one. Color
 * permutations do not change how hard a puzzle is, so nothing is lost by skipping them.
 */
public class ColoringEnumerator implements Iterator<ImmutableList<RegionColor>> {

    private final int colorCount;
    private final int[] current;
    private boolean hasPending;

    public ColoringEnumerator(int nodeCount, int colorCount) {
        if (nodeCount < 1) {
            throw new IllegalArgumentException("Node count must be positive, got " + nodeCount);
        }
        if (colorCount < 1 || colorCount > nodeCount) {
            throw new IllegalArgumentException("Color count must be between 1 and " + nodeCount + ", got " + colorCount);
        }
        this.colorCount = colorCount;
        this.current = new int[nodeCount];
        this.hasPending = usesAllColors() || advance();
    }

    @Override
    public boolean hasNext() {
        return hasPending;
    }

    @Override
    public ImmutableList<RegionColor> next() {
        if (!hasPending) {
            throw new NoSuchElementException();
        }
        ImmutableList.Builder<RegionColor> coloring = ImmutableList.builderWithExpectedSize(current.length);
        for (int index : current) {
            coloring.add(RegionColor.of(index));
        }
        hasPending = advance();
        return coloring.build();
    }

    /**
     * Step to the next restricted growth string that uses every color.
     */
    private boolean advance() {
        while (step()) {
            if (usesAllColors()) {
                return true;
            }
        }
        return false;
    }

    private boolean step() {
        for (int i = current.length - 1; i >= 1; i--) {
            int prefixMax = 0;
            for (int j = 0; j < i; j++) {
                prefixMax = Math.max(prefixMax, current[j]);
            }
            if (current[i] <= prefixMax && current[i] + 1 < colorCount) {
                current[i]++;
                for (int j = i + 1; j < current.length; j++) {
                    current[j] = 0;
                }
                return true;
            }
        }
        return false;
    }

    private boolean usesAllColors() {
        int max = 0;
        for (int index : current) {
            max = Math.max(max, index);
        }
        // Restricted growth strings use every color up to their maximum
        return max == colorCount - 1;
    }
}
