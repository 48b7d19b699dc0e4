package com.apiflow.model;

import com.apiflow.exception.ApiFlowException;
import com.apiflow.exception.MethodNotFoundException;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A parsed, read-only interface (discovery) document: the method tree plus the arena of named
 * record types its methods refer to.
 */
@Value
@Builder
public class InterfaceDocument {

    String name;
    String version;
    String rootUrl;
    String servicePath;

    /**
     * Named record types, addressed by the symbolic names used in references.
     */
    @Singular
    Map<String, TypeNode> schemas;

    /**
     * Root of the method tree.
     */
    ResourceNode root;

    public TypeNode schema(String schemaName) {
        TypeNode node = schemas.get(schemaName);
        if (node == null) {
            throw new ApiFlowException("Schema '" + schemaName + "' not found in interface document " + name + " " + version);
        }
        return node;
    }

    /**
     * Looks a dot-path such as {@code tables.list} up in the method tree: every segment but the
     * last names a resource, the last one names a method.
     *
     * @throws MethodNotFoundException naming the first absent segment and its valid alternatives.
     */
    public MethodNode method(String dotPath) {
        String path = dotPath == null ? "" : dotPath;
        String[] segments = path.split("\\.");
        ResourceNode node = root;
        for (int i = 0; i < segments.length - 1; i++) {
            ResourceNode child = node.getResources().get(segments[i]);
            if (child == null) {
                throw new MethodNotFoundException(name, path, segments[i], node.childNames());
            }
            node = child;
        }
        String leaf = segments[segments.length - 1];
        MethodNode method = node.getMethods().get(leaf);
        if (method == null) {
            throw new MethodNotFoundException(name, path, leaf, node.childNames());
        }
        return method;
    }

    public String baseUrl() {
        String root = rootUrl == null ? "" : rootUrl;
        String service = servicePath == null ? "" : servicePath;
        if (!root.isEmpty() && !root.endsWith("/")) {
            root = root + "/";
        }
        if (service.startsWith("/")) {
            service = service.substring(1);
        }
        return root + service;
    }
}
