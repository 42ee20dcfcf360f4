package de.mirkosertic.mcp.newsserver.news;

import de.mirkosertic.mcp.newsserver.provider.SearchResult;
import de.mirkosertic.mcp.newsserver.store.Article;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.UUID;

/**
 * Turns provider search hits into {@link Article}s, deriving id, summary, source, score and timestamp.
 */
public class ArticleFactory {

    static final int SUMMARY_LENGTH = 300;
    static final double DEFAULT_SCORE = 0.5;
    static final String UNKNOWN_SOURCE = "unknown";

    private final Clock clock;

    public ArticleFactory(final Clock clock) {
        this.clock = clock;
    }

    public Article create(final SearchResult result) {
        final String content = result.content() != null ? result.content() : "";
        return new Article(
                UUID.randomUUID().toString(),
                result.title(),
                result.url(),
                content,
                summarize(result.snippet(), content),
                result.publishedDate() != null && !result.publishedDate().isBlank()
                        ? result.publishedDate()
                        : clock.instant().toString(),
                hostOf(result.url()),
                result.score() != null ? result.score() : DEFAULT_SCORE,
                clock.instant().getEpochSecond()
        );
    }

    static String summarize(final String snippet, final String content) {
        if (snippet != null && !snippet.isBlank()) {
            return snippet;
        }
        final String head = content.length() > SUMMARY_LENGTH ? content.substring(0, SUMMARY_LENGTH) : content;
        return head + "...";
    }

    static String hostOf(final String url) {
        if (url == null || url.isBlank()) {
            return UNKNOWN_SOURCE;
        }
        try {
            final String host = new URI(url.trim()).getHost();
            return host != null ? host : UNKNOWN_SOURCE;
        } catch (final URISyntaxException e) {
            return UNKNOWN_SOURCE;
        }
    }
}
