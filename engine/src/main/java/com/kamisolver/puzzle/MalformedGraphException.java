package com.kamisolver.puzzle;

/**
 * Thrown when a puzzle description violates the region graph invariants
 * (unknown ids, self adjacency, asymmetric adjacency, missing colors, disconnected regions).
 */
public class MalformedGraphException extends PuzzleException {

    public MalformedGraphException(String message) {
        super(message);
    }
}
