package de.mirkosertic.mcp.medialibrary.mcp;

import de.mirkosertic.mcp.medialibrary.mcp.dto.CreateLibraryRequest;
import de.mirkosertic.mcp.medialibrary.mcp.dto.SetImportPathsRequest;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaGeneratorTest {

    @Test
    void listComponentsBecomeStringArrays() {
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(SetImportPathsRequest.class);

        assertThat(schema.required()).containsExactly("libraryId", "importPaths");
        @SuppressWarnings("unchecked")
        final Map<String, Object> paths = (Map<String, Object>) schema.properties().get("importPaths");
        assertThat(paths).containsEntry("type", "array").containsEntry("items", Map.of("type", "string"));
        assertThat(paths.get("description").toString()).startsWith("Absolute directory paths");
    }

    @Test
    void nullableComponentsAreOptional() {
        final McpSchema.JsonSchema schema = SchemaGenerator.generateSchema(CreateLibraryRequest.class);

        assertThat(schema.required()).containsExactly("name");
        assertThat(schema.properties()).containsKeys("name", "type", "ownerId", "visible");
    }

    @Test
    void toJsonOmitsNullFields() {
        final String json = ToolResultHelper.toJson(new SimpleResponse(true, null));

        assertThat(json).isEqualTo("{\"success\":true}");
    }

    record SimpleResponse(boolean success, String error) implements ToolResponse {
    }
}
