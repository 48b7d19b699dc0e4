package com.apiflow.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A callable leaf of the method tree: one REST method of a remote service.
 */
@Value
@Builder
public class MethodNode {

    /**
     * Fully qualified id from the document, e.g. {@code bigquery.tables.list}.
     */
    String id;

    /**
     * The leaf segment name, e.g. {@code list}.
     */
    String name;

    String httpMethod;

    /**
     * Path template relative to the service base URL, e.g. {@code projects/{projectId}/datasets}.
     */
    String path;

    String description;

    @Singular
    Map<String, ParameterNode> parameters;

    @Builder.Default
    List<String> parameterOrder = List.of();

    /**
     * Schema name of the request body, {@code null} when the method takes none.
     */
    String requestRef;

    /**
     * Schema name of the response body, {@code null} when the method returns none.
     */
    String responseRef;
}
