package de.mirkosertic.mcp.newsserver.news;

/**
 * Outcome of one ingestion sweep.
 */
public record FetchSummary(
        /** False if the sweep was dropped because another one was running. */
        boolean started,
        /** Last-fetch marker as it was before this sweep overwrote it. */
        long previousFetchTime,
        long fetchTime,
        int queriesProcessed,
        int queriesFailed,
        int articlesStored,
        int duplicatesSkipped,
        long durationMs
) {
    public static FetchSummary skipped() {
        return new FetchSummary(false, 0, 0, 0, 0, 0, 0, 0);
    }
}
