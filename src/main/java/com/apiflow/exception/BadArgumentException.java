package com.apiflow.exception;

/**
 * Raised when arguments cannot be bound to a method's parameters.
 */
public class BadArgumentException extends ApiFlowException {

    static final String HINT = "Are you missing a parameter or passing an id into the API as a number instead of a string?";

    public BadArgumentException(String methodId, String problem) {
        super("Cannot bind arguments for '" + methodId + "': " + problem + ". " + HINT);
    }
}
