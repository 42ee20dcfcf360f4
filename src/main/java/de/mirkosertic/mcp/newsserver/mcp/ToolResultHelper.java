package de.mirkosertic.mcp.newsserver.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.modelcontextprotocol.spec.McpSchema;

import java.util.List;

/**
 * Wraps response DTOs into MCP tool results.
 * <p>
 * Every response record carries a {@code success} flag. A result whose DTO reports
 * {@code success=false} is flagged with {@code isError=true}.
 */
public final class ToolResultHelper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ToolResultHelper() {
    }

    /**
     * Serialize the response DTO to JSON and wrap it in a TextContent.
     */
    public static McpSchema.CallToolResult createResult(final Object response) {
        return McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent(toJson(response))))
                .isError(isErrorResponse(response))
                .build();
    }

    public static String toJson(final Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (final JsonProcessingException e) {
            return "{\"success\":false,\"error\":\"JSON serialization error: " + escapeJson(e.getMessage()) + "\"}";
        }
    }

    private static boolean isErrorResponse(final Object response) {
        if (response instanceof Record record) {
            for (final var component : record.getClass().getRecordComponents()) {
                if ("success".equals(component.getName())) {
                    try {
                        final Object value = component.getAccessor().invoke(record);
                        if (value instanceof Boolean success) {
                            return !success;
                        }
                    } catch (final ReflectiveOperationException e) {
                        return false;
                    }
                }
            }
        }
        return false;
    }

    private static String escapeJson(final String str) {
        if (str == null) {
            return "";
        }
        return str.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }
}
