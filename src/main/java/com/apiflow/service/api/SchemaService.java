package com.apiflow.service.api;

import com.apiflow.model.SchemaField;
import com.apiflow.model.TypeReference;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Translates record types of an interface document into tabular and query forms.
 */
public interface SchemaService {

    /**
     * The tabular schema of a named record type.
     */
    List<SchemaField> resourceSchema(TypeReference reference);

    /**
     * The record type with every reference expanded in place, metadata retained.
     */
    ObjectNode resourceJson(TypeReference reference);

    /**
     * A select list of {@code CAST(NULL AS ...)} columns matching the record type.
     */
    String resourceStruct(TypeReference reference);

    /**
     * The tabular schema of a method's response, the row shape for collection responses.
     *
     * @param reference A reference whose name is a method dot-path, e.g. {@code sites.list}.
     * @param iterate   Forces collection unwrapping.
     */
    List<SchemaField> methodSchema(TypeReference reference, boolean iterate);
}
