package de.mirkosertic.mcp.newsserver.mcp;

import de.mirkosertic.mcp.newsserver.mcp.dto.GetLatestNewsResponse;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ToolResultHelper Tests")
class ToolResultHelperTest {

    @Test
    @DisplayName("Should flag unsuccessful responses as errors")
    void shouldFlagErrors() {
        final McpSchema.CallToolResult result = ToolResultHelper.createResult(GetLatestNewsResponse.error("Redis down"));

        assertThat(result.isError()).isTrue();
        assertThat(((McpSchema.TextContent) result.content().get(0)).text())
                .contains("\"success\" : false")
                .contains("Redis down");
    }

    @Test
    @DisplayName("Should omit null fields from successful responses")
    void shouldSerializeSuccess() {
        final McpSchema.CallToolResult result = ToolResultHelper.createResult(GetLatestNewsResponse.success(List.of()));

        assertThat(result.isError()).isFalse();
        assertThat(((McpSchema.TextContent) result.content().get(0)).text())
                .contains("\"count\" : 0")
                .doesNotContain("error");
    }
}
