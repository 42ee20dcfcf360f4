package de.mirkosertic.mcp.newsserver.news;

import org.jspecify.annotations.Nullable;

public record ExtractedContent(
        String url,
        @Nullable String title,
        String content,
        @Nullable String publishedDate
) {
}
