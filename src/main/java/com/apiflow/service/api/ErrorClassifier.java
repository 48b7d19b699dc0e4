package com.apiflow.service.api;

import com.apiflow.model.ErrorCategory;

public interface ErrorClassifier {

    /**
     * Categorizes a failed call attempt.
     *
     * @param failure  The exception raised by the attempt: an HTTP error response, a transport
     *                 exception, or a TLS exception (possibly wrapped).
     * @param creation Whether the call creates a remote object, in which case an
     *                 already-exists conflict is benign.
     * @return {@link ErrorCategory#RETRYABLE}, {@link ErrorCategory#BENIGN_DUPLICATE}, or
     *         {@link ErrorCategory#FATAL} for anything not recognized.
     */
    ErrorCategory classify(Throwable failure, boolean creation);
}
