package com.apiflow.service.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * The single place where retry decisions are made. Callers never catch-and-retry themselves.
 */
public interface RetryExecutor {

    /**
     * Runs an attempt with the configured attempt budget and base wait.
     *
     * @see #execute(Supplier, boolean, int, Duration)
     */
    JsonNode execute(Supplier<JsonNode> attempt, boolean creation);

    /**
     * Runs an attempt, retrying retryable failures with exponential backoff.
     * <p>
     * A fatal failure is re-raised at once. A benign duplicate returns
     * {@link com.fasterxml.jackson.databind.node.MissingNode}. A retryable failure is retried after
     * waiting {@code baseWait}, {@code 2 * baseWait}, ... until {@code maxAttempts} invocations have
     * been made, after which the last failure is re-raised.
     *
     * @param attempt     The call to make; invoked once per attempt.
     * @param creation    Whether the call creates a remote object.
     * @param maxAttempts Total number of invocations allowed, at least 1.
     * @param baseWait    Wait before the first retry.
     * @return The attempt's result, or the no-op sentinel for a benign duplicate.
     * @throws com.apiflow.exception.RemoteCallException for classified HTTP or transport failures.
     */
    JsonNode execute(Supplier<JsonNode> attempt, boolean creation, int maxAttempts, Duration baseWait);
}
