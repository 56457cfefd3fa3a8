package com.kamisolver.puzzle;

/**
 * Thrown when a search ends without reaching a single-region state.
 *
 * <p>Every connected puzzle can be flooded, so an exhausted search points at a defect in
 * collapse or move generation and must not be retried silently.
 */
public class UnsolvableException extends PuzzleException {

    public UnsolvableException(String message) {
        super(message);
    }
}
