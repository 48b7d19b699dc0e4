package com.apiflow.model;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * An inner node of the method tree. Each path segment maps either to a child resource or to a
 * method leaf.
 */
@Value
@Builder
public class ResourceNode {

    String name;

    @Singular
    Map<String, ResourceNode> resources;

    @Singular
    Map<String, MethodNode> methods;

    /**
     * All segment names that may follow this node, sorted.
     */
    public List<String> childNames() {
        TreeSet<String> names = new TreeSet<>(resources.keySet());
        names.addAll(methods.keySet());
        return List.copyOf(names);
    }
}
