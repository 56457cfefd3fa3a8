package com.kamisolver.puzzle;

/**
 * Base class for errors raised by the puzzle engine.
 */
public class PuzzleException extends RuntimeException {

    public PuzzleException(String message) {
        super(message);
    }

    public PuzzleException(String message, Throwable cause) {
        super(message, cause);
    }
}
