package com.kamisolver.puzzle;

import lombok.Getter;

/**
 * Thrown when a move targets an unknown region or would not change its color.
 *
 * <p>Always recoverable: the caller rejects the move and the puzzle is left unchanged.
 */
@Getter
public class InvalidMoveException extends PuzzleException {

    private final Move move;

    public InvalidMoveException(Move move, String message) {
        super(message + ": " + move);
        this.move = move;
    }
}
