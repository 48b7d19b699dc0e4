package com.apiflow.exception;

/**
 * Base runtime exception for every error raised by the remote-call and schema engines.
 * <p>
 * Subclasses narrow the failure down to caller mistakes ({@link MethodNotFoundException},
 * {@link BadArgumentException}) or classified remote failures ({@link RemoteCallException}).
 */
public class ApiFlowException extends RuntimeException {

    /**
     * Constructs a new ApiFlowException with the specified detail message.
     *
     * @param message The detail message.
     */
    public ApiFlowException(String message) {
        super(message);
    }

    /**
     * Constructs a new ApiFlowException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The underlying cause, may be {@code null}.
     */
    public ApiFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
