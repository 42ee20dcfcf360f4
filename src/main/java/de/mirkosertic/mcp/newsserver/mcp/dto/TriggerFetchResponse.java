package de.mirkosertic.mcp.newsserver.mcp.dto;

import de.mirkosertic.mcp.newsserver.news.FetchSummary;

/**
 * Response DTO for the triggerFetch tool. {@code started} is false when a sweep was already running.
 */
public record TriggerFetchResponse(
        boolean success,
        String message,
        boolean started,
        int queriesProcessed,
        int queriesFailed,
        int articlesStored,
        int duplicatesSkipped,
        long durationMs,
        String error
) {
    public static TriggerFetchResponse success(final FetchSummary summary) {
        return new TriggerFetchResponse(
                true,
                summary.started() ? "News fetch completed" : "News fetch already in progress",
                summary.started(),
                summary.queriesProcessed(),
                summary.queriesFailed(),
                summary.articlesStored(),
                summary.duplicatesSkipped(),
                summary.durationMs(),
                null
        );
    }

    public static TriggerFetchResponse error(final String errorMessage) {
        return new TriggerFetchResponse(false, null, false, 0, 0, 0, 0, 0, errorMessage);
    }
}
