package de.mirkosertic.mcp.newsserver.mcp.dto;

import de.mirkosertic.mcp.newsserver.mcp.Description;
import de.mirkosertic.mcp.newsserver.news.ValidationException;
import de.mirkosertic.mcp.newsserver.provider.SearchDepth;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the searchNews tool.
 */
public record SearchNewsRequest(
        @Description("The search query for DeFi and crypto related news.")
        String query,

        @Nullable
        @Description("Maximum number of results to return. Default is 5, allowed range 1 to 20.")
        Integer maxResults,

        @Nullable
        @Description("Depth of the live search if the cache cannot answer: basic (default) or advanced.")
        SearchDepth searchDepth
) {
    static final int DEFAULT_MAX_RESULTS = 5;
    static final int MAX_MAX_RESULTS = 20;

    /**
     * Create a SearchNewsRequest from a Map of arguments. Accepts camelCase and snake_case keys.
     */
    public static SearchNewsRequest fromMap(final Map<String, Object> arguments) {
        final Map<String, Object> args = arguments != null ? arguments : Map.of();
        final Object maxResults = args.containsKey("maxResults") ? args.get("maxResults") : args.get("max_results");
        final Object depth = args.containsKey("searchDepth") ? args.get("searchDepth") : args.get("search_depth");

        final SearchDepth searchDepth;
        try {
            searchDepth = depth != null ? SearchDepth.parse(depth.toString(), null) : null;
        } catch (final IllegalArgumentException e) {
            throw new ValidationException("Invalid searchDepth '" + depth + "', expected basic or advanced");
        }

        return new SearchNewsRequest(
                args.get("query") != null ? args.get("query").toString() : null,
                maxResults instanceof Number number ? number.intValue() : null,
                searchDepth
        );
    }

    public int effectiveMaxResults() {
        return (maxResults != null && maxResults > 0) ? Math.min(maxResults, MAX_MAX_RESULTS) : DEFAULT_MAX_RESULTS;
    }

    public SearchDepth effectiveSearchDepth() {
        return searchDepth != null ? searchDepth : SearchDepth.BASIC;
    }
}
