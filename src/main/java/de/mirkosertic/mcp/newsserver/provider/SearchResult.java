package de.mirkosertic.mcp.newsserver.provider;

import org.jspecify.annotations.Nullable;

/**
 * One hit returned by a live search provider.
 */
public record SearchResult(
        String title,
        String url,
        String content,
        @Nullable String snippet,
        @Nullable String publishedDate,
        @Nullable Double score
) {
}
