package de.mirkosertic.mcp.newsserver.provider;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Options for a single live search call.
 */
public record SearchOptions(
        SearchDepth searchDepth,
        int maxResults,
        List<String> includeDomains,
        boolean includeRawContent,
        /** Recency window such as {@code "week"}, null for no restriction. */
        @Nullable String timeRange,
        /** Search topic, {@code "news"} is required by the provider for {@link #timeRange()} to apply. */
        @Nullable String topic
) {
    public SearchOptions {
        includeDomains = includeDomains == null ? List.of() : List.copyOf(includeDomains);
    }
}
