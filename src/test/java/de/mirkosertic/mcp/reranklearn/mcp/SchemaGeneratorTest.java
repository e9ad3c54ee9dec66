package de.mirkosertic.mcp.reranklearn.mcp;

import de.mirkosertic.mcp.reranklearn.mcp.dto.RollbackModelRequest;
import de.mirkosertic.mcp.reranklearn.mcp.dto.SubmitFeedbackRequest;
import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SchemaGenerator Tests")
class SchemaGeneratorTest {

    @Test
    @DisplayName("Nullable components are optional")
    void nullableComponentsAreOptional() {
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(SubmitFeedbackRequest.class);

        assertThat(schema.type()).isEqualTo("object");
        assertThat(schema.required()).containsExactly("query", "resultId", "relevanceScore");
        assertThat(schema.properties()).containsOnlyKeys("query", "resultId", "relevanceScore", "timestamp", "userId");
    }

    record LimitRequest(@ToolParam("Name") String name, @Nullable @ToolParam("Limit") Integer limit) {
    }

    @Test
    @DisplayName("Type-use nullable annotations on boxed components are honoured")
    void nullableBoxedComponentIsOptional() {
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(LimitRequest.class);

        assertThat(schema.required()).containsExactly("name");
        assertThat(schema.properties()).containsOnlyKeys("name", "limit");
    }

    @Test
    @DisplayName("Numeric bounds and descriptions are emitted")
    @SuppressWarnings("unchecked")
    void boundsAndDescriptions() {
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(SubmitFeedbackRequest.class);

        final Map<String, Object> score = (Map<String, Object>) schema.properties().get("relevanceScore");
        assertThat(score).containsEntry("type", "number")
                .containsEntry("minimum", 0.0)
                .containsEntry("maximum", 1.0)
                .containsKey("description");

        final Map<String, Object> query = (Map<String, Object>) schema.properties().get("query");
        assertThat(query).containsEntry("type", "string").doesNotContainKey("minimum");
    }

    @Test
    @DisplayName("Empty schema has no properties")
    void emptySchema() {
        assertThat(SchemaGenerator.emptySchema().properties()).isEmpty();
        assertThat(SchemaGenerator.generateSchema(RollbackModelRequest.class).required()).containsExactly("versionId");
    }
}
