package de.mirkosertic.mcp.medialibrary.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.List;
import java.util.Map;

/**
 * Wraps response DTOs into MCP tool results.
 */
public final class ToolResultHelper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private ToolResultHelper() {
    }

    /**
     * Serialize the response to JSON text content. The result is flagged as an error when the
     * response reports {@code success == false}.
     */
    public static McpSchema.CallToolResult createResult(final ToolResponse response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(!response.success())
                .build();
    }

    public static String toJson(final Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (final JsonProcessingException e) {
            return errorJson("JSON serialization error: " + e.getOriginalMessage());
        }
    }

    private static String errorJson(final String message) {
        try {
            return OBJECT_MAPPER.writeValueAsString(Map.of("success", false, "error", message));
        } catch (final JsonProcessingException e) {
            return "{\"success\":false}";
        }
    }
}
