package de.mirkosertic.mcp.newsserver.mcp.dto;

import de.mirkosertic.mcp.newsserver.mcp.Description;

import java.util.Map;

/**
 * Request DTO for the getFullContent tool.
 */
public record GetFullContentRequest(
        @Description("The URL of the web page to extract content from")
        String url
) {
    public static GetFullContentRequest fromMap(final Map<String, Object> args) {
        return new GetFullContentRequest(args != null && args.get("url") != null ? args.get("url").toString() : null);
    }
}
