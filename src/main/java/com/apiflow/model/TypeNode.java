package com.apiflow.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One entry of an interface document's type graph.
 * <p>
 * References are kept symbolic ({@link #getRef()} names another schema in
 * {@link InterfaceDocument#getSchemas()}), so cyclic record types are representable without
 * pointer cycles. Object properties are held in lexicographic order.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TypeNode {

    public enum Kind {
        SCALAR, OBJECT, ARRAY, REFERENCE
    }

    private final Kind kind;

    /**
     * Primitive type of a scalar ({@code string}, {@code integer}, {@code number}, {@code boolean}, {@code any}).
     */
    private final String type;

    private final String format;

    /**
     * Name of the referenced schema, only for {@link Kind#REFERENCE}.
     */
    private final String ref;

    private final SortedMap<String, TypeNode> properties;

    /**
     * Element type, only for {@link Kind#ARRAY}.
     */
    private final TypeNode items;

    /**
     * Value type of a free-form map object, may be {@code null}.
     */
    private final TypeNode additionalProperties;

    /**
     * Non-structural metadata copied from the document (description, enum, enumDescriptions, ...).
     */
    private final Map<String, JsonNode> attributes;

    public static TypeNode scalar(String type, String format, Map<String, JsonNode> attributes) {
        return new TypeNode(Kind.SCALAR, type == null ? "any" : type, format, null,
                Collections.emptySortedMap(), null, null, copy(attributes));
    }

    public static TypeNode object(Map<String, TypeNode> properties, TypeNode additionalProperties, Map<String, JsonNode> attributes) {
        return new TypeNode(Kind.OBJECT, "object", null, null,
                Collections.unmodifiableSortedMap(new TreeMap<>(properties)), null, additionalProperties, copy(attributes));
    }

    public static TypeNode array(TypeNode items, Map<String, JsonNode> attributes) {
        return new TypeNode(Kind.ARRAY, "array", null, null,
                Collections.emptySortedMap(), items, null, copy(attributes));
    }

    public static TypeNode reference(String ref, Map<String, JsonNode> attributes) {
        return new TypeNode(Kind.REFERENCE, null, null, ref,
                Collections.emptySortedMap(), null, null, copy(attributes));
    }

    /**
     * An object carrying only {@code additionalProperties}: a map with arbitrary keys that has
     * no fixed tabular shape.
     */
    public boolean isFreeFormMap() {
        return kind == Kind.OBJECT && properties.isEmpty() && additionalProperties != null;
    }

    public List<String> getEnumValues() {
        JsonNode values = attributes.get("enum");
        if (values == null || !values.isArray()) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        values.forEach(v -> result.add(v.asText()));
        return result;
    }

    private static Map<String, JsonNode> copy(Map<String, JsonNode> attributes) {
        return attributes == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(attributes));
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SCALAR -> format == null ? type : type + "(" + format + ")";
            case OBJECT -> "object" + properties.keySet();
            case ARRAY -> "array<" + items + ">";
            case REFERENCE -> "$ref:" + ref;
        };
    }
}
