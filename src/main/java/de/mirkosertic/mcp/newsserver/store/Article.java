package de.mirkosertic.mcp.newsserver.store;

/**
 * A cached news article. Created once at ingestion and never updated in place.
 */
public record Article(
        String id,
        String title,
        String url,
        String content,
        String summary,
        /** Publication date as reported by the source, ISO-8601 ingestion time if absent. */
        String publishedDate,
        /** Host name derived from {@link #url()}. */
        String source,
        /** Provider relevance score in [0,1]. */
        double score,
        /** Ingestion time in Unix seconds, used for ordering and expiry accounting. */
        long timestamp
) {
}
