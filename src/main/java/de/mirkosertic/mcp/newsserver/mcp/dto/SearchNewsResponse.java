package de.mirkosertic.mcp.newsserver.mcp.dto;

import java.util.List;

/**
 * Response DTO for the searchNews tool. {@code origin} is {@code cache} or {@code live}.
 */
public record SearchNewsResponse(
        boolean success,
        String origin,
        String query,
        int count,
        List<NewsItem> results,
        String error
) {
    public static SearchNewsResponse success(final String origin, final String query, final List<NewsItem> results) {
        return new SearchNewsResponse(true, origin, query, results.size(), results, null);
    }

    public static SearchNewsResponse error(final String errorMessage) {
        return new SearchNewsResponse(false, null, null, 0, null, errorMessage);
    }
}
