package com.apiflow.exception;

import com.apiflow.model.ErrorCategory;
import lombok.Getter;

/**
 * A remote or transport failure that the retry executor gave up on.
 * <p>
 * The remote error body is kept verbatim so operators can act on it; the original
 * transport exception is available through {@link #getCause()}.
 */
@Getter
public class RemoteCallException extends ApiFlowException {

    private final ErrorCategory category;
    private final int status;
    private final String body;

    public RemoteCallException(ErrorCategory category, int status, String body, Throwable cause) {
        super(buildMessage(category, status, body, cause), cause);
        this.category = category;
        this.status = status;
        this.body = body;
    }

    private static String buildMessage(ErrorCategory category, int status, String body, Throwable cause) {
        if (status == 0) {
            return category + " transport failure: " + cause;
        }
        return category + " remote failure " + status + ": " + body;
    }
}
