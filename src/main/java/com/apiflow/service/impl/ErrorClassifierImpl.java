package com.apiflow.service.impl;

import com.apiflow.config.EngineProperties;
import com.apiflow.model.ErrorCategory;
import com.apiflow.service.api.ErrorClassifier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Classifies remote failures for the retry executor.
 * <ul>
 *   <li>HTTP 409 on a creation call: {@link ErrorCategory#BENIGN_DUPLICATE}.</li>
 *   <li>HTTP 403: {@link ErrorCategory#FATAL} when the body reports {@code PERMISSION_DENIED} or a
 *       reason from {@code apiflow.retry.fatal-forbidden-reasons}, otherwise a rate limit and
 *       {@link ErrorCategory#RETRYABLE}.</li>
 *   <li>HTTP statuses from {@code apiflow.retry.retryable-statuses} (429, 500, 503):
 *       {@link ErrorCategory#RETRYABLE}.</li>
 *   <li>TLS timeouts and transport I/O errors (reset, premature close, incomplete read):
 *       {@link ErrorCategory#RETRYABLE}; any other TLS error is {@link ErrorCategory#FATAL}.</li>
 *   <li>Everything else: {@link ErrorCategory#FATAL}.</li>
 * </ul>
 */
@Service
@Slf4j
public class ErrorClassifierImpl implements ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    private final EngineProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ErrorClassifierImpl(EngineProperties properties) {
        this.properties = properties;
    }

    @Override
    public ErrorCategory classify(Throwable failure, boolean creation) {
        if (failure == null) {
            return ErrorCategory.FATAL;
        }

        WebClientResponseException response = findCause(failure, WebClientResponseException.class);
        if (response != null) {
            return classifyResponse(response.getStatusCode().value(), response.getResponseBodyAsString(), creation);
        }

        // SSLException is an IOException too, so it has to be looked at first
        SSLException ssl = findCause(failure, SSLException.class);
        if (ssl != null) {
            return isTimeout(ssl) ? ErrorCategory.RETRYABLE : ErrorCategory.FATAL;
        }

        if (findCause(failure, IOException.class) != null
                || findCause(failure, TimeoutException.class) != null
                || findCause(failure, io.netty.handler.timeout.TimeoutException.class) != null) {
            return ErrorCategory.RETRYABLE;
        }

        return ErrorCategory.FATAL;
    }

    ErrorCategory classifyResponse(int status, String body, boolean creation) {
        if (status == 409) {
            return creation ? ErrorCategory.BENIGN_DUPLICATE : ErrorCategory.FATAL;
        }
        if (status == 403) {
            return isPermissionProblem(body) ? ErrorCategory.FATAL : ErrorCategory.RETRYABLE;
        }
        if (properties.getRetry().getRetryableStatuses().contains(status)) {
            return ErrorCategory.RETRYABLE;
        }
        return ErrorCategory.FATAL;
    }

    private boolean isPermissionProblem(String body) {
        JsonNode error;
        try {
            error = objectMapper.readTree(body == null ? "" : body).path("error");
        } catch (IOException e) {
            log.debug("Unparseable 403 body, treating as permission problem: {}", body);
            return true;
        }
        if (error.isMissingNode()) {
            return true;
        }
        if ("PERMISSION_DENIED".equals(error.path("status").asText())) {
            return true;
        }
        for (JsonNode detail : error.path("errors")) {
            if (properties.getRetry().getFatalForbiddenReasons().contains(detail.path("reason").asText())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTimeout(SSLException ssl) {
        String message = ssl.getMessage();
        return (message != null && message.contains("timed out")) || findCause(ssl, SocketTimeoutException.class) != null;
    }

    /**
     * Walks the cause chain of {@code failure}, itself included, for the first throwable of the
     * given type.
     */
    static <T extends Throwable> T findCause(Throwable failure, Class<T> type) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
        }
        return null;
    }
}
