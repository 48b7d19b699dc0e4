package com.apiflow.model;

import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An immutable description of a single remote call: which service, which method, and
 * with what arguments.
 * <p>
 * Instances are usually read from JSON (see {@code apiflow.run.descriptor}) or built in code:
 * <pre>
 * CallDescriptor.builder()
 *     .serviceId("dfareporting").version("v4").auth("user")
 *     .method("placements.list")
 *     .argument("profileId", "1234")
 *     .iterate(true)
 *     .build();
 * </pre>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CallDescriptor {

    /**
     * The API name, e.g. {@code bigquery} or {@code displayvideo}.
     */
    String serviceId;

    /**
     * The API version, e.g. {@code v2}.
     */
    String version;

    /**
     * Dot-separated path of the method in the service's method tree, e.g. {@code tables.list}.
     */
    String method;

    /**
     * Arguments passed to the method. The reserved name {@code body} carries the request body.
     */
    @Singular
    Map<String, Object> arguments;

    /**
     * The auth context handed to the credential provider, e.g. {@code user} or {@code service}.
     */
    String auth;

    /**
     * When true, a paginated result is returned as an element iterator.
     */
    boolean iterate;

    /**
     * Optional maximum number of elements yielded when iterating.
     */
    Integer limit;

    /**
     * Optional developer key sent with discovery and method calls.
     */
    String key;

    /**
     * Optional discovery labels, used to fetch label-restricted documents.
     */
    String labels;

    /**
     * Extra headers attached to every outbound request.
     */
    @Singular
    Map<String, String> headers;

    /**
     * Optional local interface document: inline JSON or a file path.
     */
    String documentSource;
}
