package com.apiflow.model;

/**
 * Outcome of classifying a failed remote call.
 */
public enum ErrorCategory {
    /**
     * Transient condition (rate limit, 5xx, connection reset, TLS timeout); worth another attempt.
     */
    RETRYABLE,
    /**
     * Retrying cannot help (authorization, malformed call, anything unrecognized).
     */
    FATAL,
    /**
     * A creation call collided with an existing object; treated as already satisfied.
     */
    BENIGN_DUPLICATE
}
