package com.apiflow.engine;

import com.apiflow.exception.ApiFlowException;
import com.apiflow.model.InterfaceDocument;
import com.apiflow.model.MethodNode;
import com.apiflow.model.SchemaField;
import com.apiflow.model.TypeNode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Translates the type graph of one interface document into a BigQuery schema, a fully expanded
 * object tree, or a select list of typed {@code NULL} columns.
 * <p>
 * Record types may reference themselves directly or transitively. Every traversal therefore keeps
 * a visit counter per reference name: a reference is expanded only while its counter is below the
 * recursion depth, the counter is raised for the descent and restored afterwards. The budget is
 * per branch, so sibling fields referencing the same type each get the full depth. Properties are
 * visited in lexicographic order at every level, which keeps the output stable between runs.
 * <p>
 * See https://developers.google.com/discovery/v1/type-format and
 * https://cloud.google.com/bigquery/docs/schemas#standard_sql_data_types.
 */
@Slf4j
public class TypeGraphWalker {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final InterfaceDocument document;
    private final int recursionDepth;
    private final int descriptionLength;

    public TypeGraphWalker(InterfaceDocument document, int recursionDepth, int descriptionLength) {
        this.document = document;
        this.recursionDepth = recursionDepth;
        this.descriptionLength = descriptionLength;
    }

    /**
     * Maps a scalar type node to its BigQuery column type.
     */
    public static String toType(TypeNode node) {
        String format = node.getFormat() == null ? "" : node.getFormat();
        return switch (node.getType()) {
            case "boolean" -> "BOOLEAN";
            case "integer" -> "INT64";
            case "number" -> "double".equals(format) ? "FLOAT64" : "FLOAT";
            case "string" -> switch (format) {
                case "byte" -> "BYTES";
                case "date" -> "DATE";
                case "date-time" -> "TIMESTAMP";
                // int64 and uint64 stay strings, the wire format and most ids expect them that way
                default -> "STRING";
            };
            default -> "STRING";
        };
    }

    public List<SchemaField> resourceSchema(String schemaName) {
        return toSchema(document.schema(schemaName));
    }

    public ObjectNode resourceJson(String schemaName) {
        return toObjectTree(document.schema(schemaName));
    }

    public String resourceStruct(String schemaName) {
        return toStruct(document.schema(schemaName));
    }

    /**
     * The schema of a method's response. Collection responses, recognized by name
     * ({@code ...List...Response}), by carrying a single repeated field next to a
     * {@code nextPageToken}, or forced through {@code iterate}, are unwrapped to their element shape.
     */
    public List<SchemaField> methodSchema(String dotPath, boolean iterate) {
        MethodNode method = document.method(dotPath);
        String responseRef = method.getResponseRef();
        if (responseRef == null) {
            throw new ApiFlowException("Method '" + dotPath + "' of " + document.getName() + " returns no response body");
        }
        TypeNode response = document.schema(responseRef);
        List<SchemaField> schema = toSchema(response);
        if (iterate || isCollectionResponse(responseRef, response, schema)) {
            return unwrap(dotPath, schema);
        }
        return schema;
    }

    /**
     * The tabular schema of a record type. The starting node itself does not count against the
     * recursion budget.
     */
    public List<SchemaField> toSchema(TypeNode node) {
        return fields(requireObject(node), new HashMap<>());
    }

    /**
     * The record type with references replaced by their targets, all metadata kept. References past
     * the recursion depth become JSON {@code null}.
     */
    public ObjectNode toObjectTree(TypeNode node) {
        return (ObjectNode) tree(requireObject(node), new HashMap<>());
    }

    /**
     * One {@code CAST(NULL AS type) AS name} column per field, nested records as {@code STRUCT(...)},
     * joined into a select list that yields a placeholder row of the record's shape.
     */
    public String toStruct(TypeNode node) {
        return struct(requireObject(node), new HashMap<>(), 2);
    }

    // ------------------------------------------------------------------ //

    private List<SchemaField> fields(TypeNode object, Map<String, Integer> visits) {
        List<SchemaField> result = new ArrayList<>();
        object.getProperties().forEach((name, node) -> {
            SchemaField field = field(name, node, SchemaField.NULLABLE, visits);
            if (field != null) {
                result.add(field);
            }
        });
        return result;
    }

    private SchemaField field(String name, TypeNode node, String mode, Map<String, Integer> visits) {
        switch (node.getKind()) {
            case REFERENCE:
                return expand(node.getRef(), visits,
                        target -> field(name, target, mode, visits),
                        () -> SchemaField.leaf(name, "STRING", SchemaField.NULLABLE, "Recursive reference to " + node.getRef() + " truncated."));
            case OBJECT:
                if (node.isFreeFormMap()) {
                    log.warn("Skipping ambiguous record '{}': {}", name, node);
                    return null;
                }
                if (node.getProperties().isEmpty()) {
                    return SchemaField.leaf(name, "STRING", mode, description(node));
                }
                return SchemaField.record(name, mode, fields(node, visits));
            case ARRAY:
                if (SchemaField.REPEATED.equals(mode)) {
                    // BigQuery has no arrays of arrays
                    return SchemaField.leaf(name, "STRING", SchemaField.REPEATED, description(node));
                }
                return field(name, node.getItems(), SchemaField.REPEATED, visits);
            default:
                return SchemaField.leaf(name, toType(node), mode, description(node));
        }
    }

    private JsonNode tree(TypeNode node, Map<String, Integer> visits) {
        ObjectNode result = NODES.objectNode();
        switch (node.getKind()) {
            case REFERENCE:
                return expand(node.getRef(), visits, target -> {
                    JsonNode expanded = tree(target, visits);
                    if (expanded instanceof ObjectNode expandedObject) {
                        node.getAttributes().forEach((key, value) -> expandedObject.set(key, value.deepCopy()));
                    }
                    return expanded;
                }, NullNode::getInstance);
            case OBJECT:
                node.getAttributes().forEach((key, value) -> result.set(key, value.deepCopy()));
                result.put("type", "object");
                if (!node.getProperties().isEmpty()) {
                    ObjectNode properties = result.putObject("properties");
                    node.getProperties().forEach((name, child) -> properties.set(name, tree(child, visits)));
                }
                if (node.getAdditionalProperties() != null) {
                    result.set("additionalProperties", tree(node.getAdditionalProperties(), visits));
                }
                return result;
            case ARRAY:
                node.getAttributes().forEach((key, value) -> result.set(key, value.deepCopy()));
                result.put("type", "array");
                result.set("items", tree(node.getItems(), visits));
                return result;
            default:
                node.getAttributes().forEach((key, value) -> result.set(key, value.deepCopy()));
                result.put("type", node.getType());
                if (node.getFormat() != null) {
                    result.put("format", node.getFormat());
                }
                return result;
        }
    }

    private String struct(TypeNode object, Map<String, Integer> visits, int indent) {
        return object.getProperties().entrySet().stream()
                .map(entry -> structField(entry.getKey(), entry.getValue(), visits, indent))
                .collect(Collectors.joining(",\n"));
    }

    private String structField(String name, TypeNode node, Map<String, Integer> visits, int indent) {
        String spaces = " ".repeat(indent);
        switch (node.getKind()) {
            case REFERENCE:
                return expand(node.getRef(), visits,
                        target -> structField(name, target, visits, indent),
                        () -> spaces + "CAST(NULL AS STRING) AS " + quote(name));
            case OBJECT:
                if (node.getProperties().isEmpty()) {
                    return spaces + "CAST(NULL AS STRING) AS " + quote(name);
                }
                return spaces + "STRUCT(\n" + struct(node, visits, indent + 2) + "\n" + spaces + ") AS " + quote(name);
            case ARRAY:
                return arrayField(name, node.getItems(), visits, indent);
            default:
                return spaces + "CAST(NULL AS " + sqlType(node) + ") AS " + quote(name);
        }
    }

    private String arrayField(String name, TypeNode items, Map<String, Integer> visits, int indent) {
        String spaces = " ".repeat(indent);
        switch (items.getKind()) {
            case REFERENCE:
                return expand(items.getRef(), visits,
                        target -> arrayField(name, target, visits, indent),
                        () -> spaces + "CAST(NULL AS ARRAY<STRING>) AS " + quote(name));
            case OBJECT:
                if (items.getProperties().isEmpty()) {
                    return spaces + "CAST(NULL AS ARRAY<STRING>) AS " + quote(name);
                }
                return spaces + "[STRUCT(\n" + struct(items, visits, indent + 2) + "\n" + spaces + ")] AS " + quote(name);
            case ARRAY:
                return spaces + "CAST(NULL AS ARRAY<STRING>) AS " + quote(name);
            default:
                return spaces + "CAST(NULL AS ARRAY<" + sqlType(items) + ">) AS " + quote(name);
        }
    }

    private <T> T expand(String ref, Map<String, Integer> visits, Function<TypeNode, T> descend, Supplier<T> truncated) {
        int depth = visits.getOrDefault(ref, 0);
        if (depth >= recursionDepth) {
            return truncated.get();
        }
        visits.put(ref, depth + 1);
        try {
            return descend.apply(document.schema(ref));
        } finally {
            visits.put(ref, depth);
        }
    }

    private TypeNode requireObject(TypeNode node) {
        TypeNode resolved = node;
        while (resolved.getKind() == TypeNode.Kind.REFERENCE) {
            resolved = document.schema(resolved.getRef());
        }
        if (resolved.getKind() != TypeNode.Kind.OBJECT) {
            throw new ApiFlowException("Only record types can be translated, got " + resolved);
        }
        return resolved;
    }

    private boolean isCollectionResponse(String responseRef, TypeNode response, List<SchemaField> schema) {
        if (responseRef.contains("List") && responseRef.endsWith("Response")) {
            return true;
        }
        long repeated = schema.stream().filter(SchemaField::isRepeated).count();
        return repeated == 1 && response.getProperties().containsKey(PageIterator.NEXT_PAGE_TOKEN);
    }

    private List<SchemaField> unwrap(String dotPath, List<SchemaField> schema) {
        for (SchemaField field : schema) {
            if (field.isRepeated()) {
                return field.isRecord() ? field.fields() : List.of(field.withMode(SchemaField.NULLABLE));
            }
        }
        throw new ApiFlowException("Unhandled collection schema for method '" + dotPath + "': no repeated field in " + schema);
    }

    private String description(TypeNode node) {
        List<String> values = node.getEnumValues();
        if (values.isEmpty()) {
            return null;
        }
        String joined = String.join(",", values);
        return joined.length() > descriptionLength ? joined.substring(0, descriptionLength) : joined;
    }

    private static String sqlType(TypeNode node) {
        String type = toType(node);
        return "FLOAT".equals(type) ? "FLOAT64" : type;
    }

    private static String quote(String name) {
        return "`" + name + "`";
    }
}
