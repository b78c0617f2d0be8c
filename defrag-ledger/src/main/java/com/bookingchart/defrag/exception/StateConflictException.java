package com.bookingchart.defrag.exception;

/**
 * A transition was attempted on a move or batch that is no longer in a state that allows it.
 * Covers both already-finalized moves and concurrent transitions that lost the race.
 */
public class StateConflictException extends RuntimeException {

    public StateConflictException(String message) {
        super(message);
    }

    public StateConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
