package de.mirkosertic.mcp.newsserver.mcp.dto;

import de.mirkosertic.mcp.newsserver.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the getLatestNews tool.
 */
public record GetLatestNewsRequest(
        @Nullable
        @Description("Maximum number of news articles to return. Default is 10, allowed range 1 to 50.")
        Integer limit
) {
    static final int DEFAULT_LIMIT = 10;
    static final int MAX_LIMIT = 50;

    public static GetLatestNewsRequest fromMap(final Map<String, Object> args) {
        return new GetLatestNewsRequest(
                args != null && args.get("limit") instanceof Number number ? number.intValue() : null
        );
    }

    public int effectiveLimit() {
        return (limit != null && limit > 0) ? Math.min(limit, MAX_LIMIT) : DEFAULT_LIMIT;
    }
}
