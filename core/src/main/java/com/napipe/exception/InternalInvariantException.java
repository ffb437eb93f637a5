package com.napipe.exception;

/**
 * Exception thrown when a composed pipeline violates a guarantee the planner is
 * responsible for. It signals a planning bug, never a user error.
 */
public class InternalInvariantException extends RuntimeException {

    public InternalInvariantException(String message) {
        super(message);
    }
}
