package com.kamisolver.puzzle;

import com.kamisolver.color.RegionColor;
import lombok.Value;

/**
 * A single puzzle move: recolor region {@code targetId} to {@code color}.
 */
@Value
public class Move {

    int targetId;
    RegionColor color;

    public static Move of(int targetId, RegionColor color) {
        return new Move(targetId, color);
    }

    @Override
    public String toString() {
        return "Set node " + targetId + " to " + color;
    }
}
