package de.mirkosertic.mcp.knowledgebase.mcp;

import de.mirkosertic.mcp.knowledgebase.mcp.dto.GetSourceContentRequest;
import de.mirkosertic.mcp.knowledgebase.mcp.dto.ListSourcesRequest;
import de.mirkosertic.mcp.knowledgebase.mcp.dto.ReindexRequest;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SchemaGenerator Tests")
class SchemaGeneratorTest {

    @Test
    @DisplayName("Non-nullable components should be required and carry their description")
    void shouldMarkRequiredComponents() {
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(GetSourceContentRequest.class);

        assertThat(schema.type()).isEqualTo("object");
        assertThat(schema.required()).containsExactly("sourceId");
        @SuppressWarnings("unchecked")
        final Map<String, Object> sourceId = (Map<String, Object>) schema.properties().get("sourceId");
        assertThat(sourceId).containsEntry("type", "string");
        assertThat((String) sourceId.get("description")).contains("relative to the sources directory");
    }

    @Test
    @DisplayName("Nullable components should be optional")
    void shouldTreatNullableAsOptional() {
        final McpSchema.JsonSchema reindex = SchemaGenerator.generateSchema(ReindexRequest.class);
        final McpSchema.JsonSchema listSources = SchemaGenerator.generateSchema(ListSourcesRequest.class);

        assertThat(reindex.required()).isEmpty();
        assertThat(reindex.properties()).containsKey("refreshUrls");
        @SuppressWarnings("unchecked")
        final Map<String, Object> refreshUrls = (Map<String, Object>) reindex.properties().get("refreshUrls");
        assertThat(refreshUrls).containsEntry("type", "boolean");
        assertThat(listSources.required()).isEmpty();
    }

    @Test
    @DisplayName("Should map Java types to JSON schema types")
    void shouldMapJsonTypes() {
        assertThat(SchemaGenerator.jsonType(String.class)).isEqualTo("string");
        assertThat(SchemaGenerator.jsonType(long.class)).isEqualTo("integer");
        assertThat(SchemaGenerator.jsonType(Double.class)).isEqualTo("number");
        assertThat(SchemaGenerator.jsonType(Boolean.class)).isEqualTo("boolean");
        assertThat(SchemaGenerator.jsonType(List.class)).isEqualTo("array");
        assertThat(SchemaGenerator.jsonType(Map.class)).isEqualTo("object");
    }

    @Test
    @DisplayName("Empty schema should have no properties")
    void shouldCreateEmptySchema() {
        final McpSchema.JsonSchema schema = SchemaGenerator.emptySchema();

        assertThat(schema.type()).isEqualTo("object");
        assertThat(schema.properties()).isEmpty();
        assertThat(schema.required()).isEmpty();
    }
}
