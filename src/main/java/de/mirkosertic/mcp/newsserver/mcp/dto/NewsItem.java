package de.mirkosertic.mcp.newsserver.mcp.dto;

import de.mirkosertic.mcp.newsserver.store.Article;

/**
 * A news article as returned by the search and listing tools. {@code content} is the summary.
 */
public record NewsItem(
        String title,
        String url,
        String content,
        String publishedDate,
        String source
) {
    public static NewsItem from(final Article article) {
        return new NewsItem(
                article.title(),
                article.url(),
                article.summary(),
                article.publishedDate(),
                article.source()
        );
    }
}
