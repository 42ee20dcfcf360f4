package de.mirkosertic.mcp.newsserver.news;

import de.mirkosertic.mcp.newsserver.store.Article;

import java.util.List;

public record ResolvedResults(
        Origin origin,
        String query,
        List<Article> articles
) {
}
