package com.apiflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * One column of a tabular schema, in the shape BigQuery expects for table definitions.
 *
 * @param name        The column name.
 * @param type        The BigQuery type, {@code RECORD} for nested groups.
 * @param mode        {@code NULLABLE} or {@code REPEATED}.
 * @param description Descriptive metadata, e.g. the comma-joined enumerated values.
 * @param fields      Nested columns of a {@code RECORD}, empty otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"name", "type", "mode", "description", "fields"})
public record SchemaField(String name, String type, String mode, String description, List<SchemaField> fields) {

    public static final String NULLABLE = "NULLABLE";
    public static final String REPEATED = "REPEATED";
    public static final String RECORD = "RECORD";

    public SchemaField {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public static SchemaField leaf(String name, String type, String mode, String description) {
        return new SchemaField(name, type, mode, description, List.of());
    }

    public static SchemaField record(String name, String mode, List<SchemaField> fields) {
        return new SchemaField(name, RECORD, mode, null, fields);
    }

    public boolean isRecord() {
        return RECORD.equals(type);
    }

    public boolean isRepeated() {
        return REPEATED.equals(mode);
    }

    public SchemaField withMode(String newMode) {
        return new SchemaField(name, type, newMode, description, fields);
    }
}
