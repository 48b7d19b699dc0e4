package com.apiflow.engine;

import com.apiflow.TestResources;
import com.apiflow.config.EngineProperties;
import com.apiflow.exception.ApiFlowException;
import com.apiflow.model.InterfaceDocument;
import com.apiflow.model.SchemaField;
import com.apiflow.model.TypeNode;
import com.apiflow.service.impl.InterfaceDocumentServiceImpl;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TypeGraphWalkerTest {

    private static InterfaceDocument graph;
    private static InterfaceDocument widgets;

    @BeforeAll
    static void loadDocuments() {
        InterfaceDocumentServiceImpl parser = new InterfaceDocumentServiceImpl(WebClient.create(), new DocumentCache(), null, new EngineProperties());
        graph = parser.parse(TestResources.read("recursive-types.json"));
        widgets = parser.parse(TestResources.read("widgets-discovery.json"));
    }

    private static SchemaField field(List<SchemaField> fields, String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst()
                .orElseThrow(() -> new AssertionError("No field " + name + " in " + fields));
    }

    @Test
    void selfReferenceIsExpandedToRecursionDepthThenTruncated() {
        List<SchemaField> schema = new TypeGraphWalker(graph, 2, 1024).resourceSchema("Node");

        SchemaField level1 = field(schema, "child");
        assertThat(level1.isRecord()).isTrue();
        SchemaField level2 = field(level1.fields(), "child");
        assertThat(level2.isRecord()).isTrue();
        SchemaField truncated = field(level2.fields(), "child");
        assertThat(truncated).isEqualTo(SchemaField.leaf("child", "STRING", "NULLABLE", "Recursive reference to Node truncated."));
        assertThat(field(level2.fields(), "name").type()).isEqualTo("STRING");
    }

    @Test
    void recursionDepthOfZeroTruncatesImmediately() {
        List<SchemaField> schema = new TypeGraphWalker(graph, 0, 1024).resourceSchema("Node");

        assertThat(field(schema, "child").isRecord()).isFalse();
        assertThat(field(schema, "child").description()).contains("truncated");
    }

    @Test
    void siblingBranchesHaveIndependentBudgets() {
        List<SchemaField> schema = new TypeGraphWalker(graph, 1, 1024).resourceSchema("Pair");

        SchemaField x = field(schema, "x");
        SchemaField y = field(schema, "y");
        assertThat(x.isRecord()).isTrue();
        assertThat(y.isRecord()).isTrue();
        assertThat(y.fields()).isEqualTo(x.fields());
        assertThat(field(y.fields(), "inner").description()).isEqualTo("Recursive reference to Box truncated.");
        assertThat(field(y.fields(), "label").type()).isEqualTo("STRING");
    }

    @Test
    void scalarTypesMapToColumnTypes() {
        List<SchemaField> schema = new TypeGraphWalker(graph, 2, 1024).resourceSchema("Kitchen");

        assertThat(schema).extracting(SchemaField::name)
                .containsExactly("anything", "big", "blob", "boxes", "created", "day", "empty", "flag",
                        "matrix", "ratio", "small", "status", "tags", "weight");
        assertThat(field(schema, "anything").type()).isEqualTo("STRING");
        assertThat(field(schema, "big").type()).isEqualTo("STRING");
        assertThat(field(schema, "blob").type()).isEqualTo("BYTES");
        assertThat(field(schema, "created").type()).isEqualTo("TIMESTAMP");
        assertThat(field(schema, "day").type()).isEqualTo("DATE");
        assertThat(field(schema, "flag").type()).isEqualTo("BOOLEAN");
        assertThat(field(schema, "ratio").type()).isEqualTo("FLOAT64");
        assertThat(field(schema, "small").type()).isEqualTo("INT64");
        assertThat(field(schema, "weight").type()).isEqualTo("FLOAT");
        assertThat(field(schema, "empty")).isEqualTo(SchemaField.leaf("empty", "STRING", "NULLABLE", null));
    }

    @Test
    void arraysBecomeRepeatedColumns() {
        List<SchemaField> schema = new TypeGraphWalker(graph, 2, 1024).resourceSchema("Kitchen");

        assertThat(field(schema, "tags")).isEqualTo(SchemaField.leaf("tags", "STRING", "REPEATED", null));
        assertThat(field(schema, "matrix")).isEqualTo(SchemaField.leaf("matrix", "STRING", "REPEATED", null));
        SchemaField boxes = field(schema, "boxes");
        assertThat(boxes.type()).isEqualTo("RECORD");
        assertThat(boxes.mode()).isEqualTo("REPEATED");
        assertThat(boxes.fields()).extracting(SchemaField::name).containsExactly("inner", "label");
    }

    @Test
    void enumValuesBecomeTruncatedDescription() {
        assertThat(field(new TypeGraphWalker(graph, 2, 1024).resourceSchema("Kitchen"), "status").description())
                .isEqualTo("ACTIVE,PAUSED,ARCHIVED");
        assertThat(field(new TypeGraphWalker(graph, 2, 10).resourceSchema("Kitchen"), "status").description())
                .isEqualTo("ACTIVE,PAU");
    }

    @Test
    void freeFormMapsAreSkipped() {
        List<SchemaField> schema = new TypeGraphWalker(graph, 2, 1024).resourceSchema("Kitchen");

        assertThat(schema).extracting(SchemaField::name).doesNotContain("labels");
    }

    @Test
    void objectTreeExpandsReferencesAndKeepsMetadata() {
        ObjectNode tree = new TypeGraphWalker(graph, 2, 1024).resourceJson("Node");

        assertThat(tree.path("description").asText()).isEqualTo("A node pointing at itself.");
        assertThat(tree.at("/properties/name/type").asText()).isEqualTo("string");
        assertThat(tree.at("/properties/child/type").asText()).isEqualTo("object");
        assertThat(tree.at("/properties/child/properties/child/properties/name/type").asText()).isEqualTo("string");
        assertThat(tree.at("/properties/child/properties/child/properties/child").isNull()).isTrue();
        assertThat(tree.toString()).doesNotContain("$ref");
    }

    @Test
    void objectTreeKeepsEnumMetadataOfScalarReferences() {
        ObjectNode tree = new TypeGraphWalker(graph, 2, 1024).resourceJson("Kitchen");

        assertThat(tree.at("/properties/status/type").asText()).isEqualTo("string");
        assertThat(tree.at("/properties/status/enum/2").asText()).isEqualTo("ARCHIVED");
        assertThat(tree.at("/properties/labels/additionalProperties/type").asText()).isEqualTo("string");
        assertThat(tree.at("/properties/matrix/items/items/type").asText()).isEqualTo("integer");
    }

    @Test
    void objectTreeIsIndependentOfTheDocument() {
        TypeGraphWalker walker = new TypeGraphWalker(graph, 2, 1024);
        ObjectNode tree = walker.resourceJson("Kitchen");

        ((ArrayNode) tree.at("/properties/status/enum")).removeAll();
        ((ObjectNode) tree.at("/properties/boxes/items")).put("description", "changed");

        assertThat(graph.schema("Status").getAttributes().get("enum")).hasSize(3);
        ObjectNode again = walker.resourceJson("Kitchen");
        assertThat(again.at("/properties/status/enum/2").asText()).isEqualTo("ARCHIVED");
        assertThat(again.at("/properties/boxes/items/description").isMissingNode()).isTrue();
    }

    @Test
    void structRendersTypedNullColumns() {
        String struct = new TypeGraphWalker(graph, 2, 1024).resourceStruct("Kitchen");

        assertThat(struct).contains("  CAST(NULL AS BOOLEAN) AS `flag`")
                .contains("  CAST(NULL AS INT64) AS `small`")
                .contains("  CAST(NULL AS FLOAT64) AS `weight`")
                .contains("  CAST(NULL AS FLOAT64) AS `ratio`")
                .contains("  CAST(NULL AS TIMESTAMP) AS `created`")
                .contains("  CAST(NULL AS ARRAY<STRING>) AS `tags`")
                .contains("  CAST(NULL AS ARRAY<STRING>) AS `matrix`")
                .contains("  [STRUCT(\n")
                .contains("  )] AS `boxes`");
        assertThat(struct).doesNotEndWith(",");
    }

    @Test
    void structNestsRecordsAndTruncatesRecursion() {
        String struct = new TypeGraphWalker(graph, 2, 1024).resourceStruct("Node");

        assertThat(struct).isEqualTo(String.join("\n",
                "  STRUCT(",
                "    STRUCT(",
                "      CAST(NULL AS STRING) AS `child`,",
                "      CAST(NULL AS STRING) AS `name`",
                "    ) AS `child`,",
                "    CAST(NULL AS STRING) AS `name`",
                "  ) AS `child`,",
                "  CAST(NULL AS STRING) AS `name`"));
    }

    @Test
    void methodSchemaUnwrapsCollectionResponses() {
        TypeGraphWalker walker = new TypeGraphWalker(widgets, 2, 1024);

        List<SchemaField> expected = List.of(
                SchemaField.leaf("count", "INT64", "NULLABLE", null),
                SchemaField.leaf("id", "STRING", "NULLABLE", null));
        assertThat(walker.methodSchema("widgets.list", false)).isEqualTo(expected);
        assertThat(walker.methodSchema("widgets.search", false)).isEqualTo(expected);
        assertThat(walker.methodSchema("widgets.get", false)).isEqualTo(expected);
        assertThat(walker.methodSchema("widgets.parts.list", false))
                .containsExactly(SchemaField.leaf("tags", "STRING", "NULLABLE", null));
    }

    @Test
    void methodSchemaFailsWithoutCollectionOrResponse() {
        TypeGraphWalker walker = new TypeGraphWalker(widgets, 2, 1024);

        assertThatThrownBy(() -> walker.methodSchema("widgets.get", true))
                .isInstanceOf(ApiFlowException.class)
                .hasMessageContaining("widgets.get");
        assertThatThrownBy(() -> walker.methodSchema("widgets.delete", false))
                .isInstanceOf(ApiFlowException.class)
                .hasMessageContaining("no response body");
    }

    @Test
    void toSchemaRejectsNonRecordTypes() {
        TypeGraphWalker walker = new TypeGraphWalker(graph, 2, 1024);

        assertThatThrownBy(() -> walker.toSchema(TypeNode.scalar("string", null, Map.of())))
                .isInstanceOf(ApiFlowException.class);
        assertThatThrownBy(() -> walker.resourceSchema("Missing"))
                .isInstanceOf(ApiFlowException.class)
                .hasMessageContaining("Missing");
    }

    @Test
    void toTypeDefaultsToString() {
        assertThat(TypeGraphWalker.toType(TypeNode.scalar(null, null, Map.of()))).isEqualTo("STRING");
        assertThat(TypeGraphWalker.toType(TypeNode.scalar("number", null, Map.of()))).isEqualTo("FLOAT");
    }
}
