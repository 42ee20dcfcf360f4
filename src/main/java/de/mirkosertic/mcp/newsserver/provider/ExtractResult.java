package de.mirkosertic.mcp.newsserver.provider;

import org.jspecify.annotations.Nullable;

/**
 * Full-page content extracted for a single URL.
 */
public record ExtractResult(
        String url,
        @Nullable String title,
        String content,
        @Nullable String publishedDate
) {
}
