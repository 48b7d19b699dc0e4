package com.apiflow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Value;

/**
 * A resolved method with sanitized arguments, ready to be executed any number of times.
 * Pagination only ever changes the page token.
 */
@Value
public class BoundCall {

    public static final String BODY = "body";
    public static final String PAGE_TOKEN = "pageToken";

    ResolvedMethod resolved;
    Map<String, Object> arguments;

    public BoundCall(ResolvedMethod resolved, Map<String, Object> arguments) {
        this.resolved = resolved;
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    /**
     * Returns a copy whose page token is set, in the request body when the call carries one and
     * as a query argument otherwise.
     */
    public BoundCall withPageToken(String pageToken) {
        Map<String, Object> next = new LinkedHashMap<>(arguments);
        if (next.get(BODY) instanceof Map<?, ?> body) {
            Map<String, Object> nextBody = new LinkedHashMap<>();
            body.forEach((key, value) -> nextBody.put(String.valueOf(key), value));
            nextBody.put(PAGE_TOKEN, pageToken);
            next.put(BODY, nextBody);
        } else {
            next.put(PAGE_TOKEN, pageToken);
        }
        return new BoundCall(resolved, next);
    }
}
