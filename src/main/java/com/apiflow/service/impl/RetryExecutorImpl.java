package com.apiflow.service.impl;

import com.apiflow.config.EngineProperties;
import com.apiflow.exception.ApiFlowException;
import com.apiflow.exception.RemoteCallException;
import com.apiflow.model.ErrorCategory;
import com.apiflow.service.api.ErrorClassifier;
import com.apiflow.service.api.RetryExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.io.IOException;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Resilience4j based {@link RetryExecutor}.
 * <p>
 * A fresh {@link Retry} is built for every call, since attempt budgets and the creation flag vary
 * per call and no retry state may outlive it. Waits run on the calling thread. With the defaults
 * (3 attempts, 31s base) a failing call waits 31s and 62s before giving up; the total has to stay
 * well below the lifetime of the credential the call carries.
 */
@Service
@Slf4j
public class RetryExecutorImpl implements RetryExecutor {

    private final ErrorClassifier errorClassifier;
    private final EngineProperties properties;

    public RetryExecutorImpl(ErrorClassifier errorClassifier, EngineProperties properties) {
        this.errorClassifier = errorClassifier;
        this.properties = properties;
    }

    /**
     * The backoff schedule: {@code baseWait} before the first retry, doubled for each further one.
     */
    static IntervalFunction backoff(Duration baseWait) {
        return IntervalFunction.ofExponentialBackoff(baseWait, 2);
    }

    @Override
    public JsonNode execute(Supplier<JsonNode> attempt, boolean creation) {
        EngineProperties.RetryConfig retry = properties.getRetry();
        return execute(attempt, creation, retry.getMaxAttempts(), retry.getBaseWait());
    }

    @Override
    public JsonNode execute(Supplier<JsonNode> attempt, boolean creation, int maxAttempts, Duration baseWait) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(backoff(baseWait))
                .retryOnException(e -> errorClassifier.classify(e, creation) == ErrorCategory.RETRYABLE)
                .build();
        Retry retry = Retry.of("remote-call", config);
        retry.getEventPublisher().onRetry(event -> log.warn("API RETRY / WAIT: {} attempt(s) remaining, waiting {}s after: {}",
                maxAttempts - event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toSeconds(),
                String.valueOf(event.getLastThrowable())));

        try {
            return retry.executeSupplier(attempt);
        } catch (ApiFlowException e) {
            throw e;
        } catch (RuntimeException e) {
            ErrorCategory category = errorClassifier.classify(e, creation);
            if (category == ErrorCategory.BENIGN_DUPLICATE) {
                log.info("Object already exists, treating call as satisfied.");
                return MissingNode.getInstance();
            }
            throw translate(e, category);
        }
    }

    private RuntimeException translate(RuntimeException failure, ErrorCategory category) {
        WebClientResponseException response = ErrorClassifierImpl.findCause(failure, WebClientResponseException.class);
        if (response != null) {
            String body = response.getResponseBodyAsString();
            log.error("ERROR DETAILS: {} {}", response.getStatusCode().value(), body);
            return new RemoteCallException(category, response.getStatusCode().value(), body, failure);
        }
        if (failure instanceof WebClientRequestException || ErrorClassifierImpl.findCause(failure, IOException.class) != null) {
            log.error("HTTP ERROR: {}", failure.toString());
            return new RemoteCallException(category, 0, null, failure);
        }
        return failure;
    }
}
