package de.mirkosertic.mcp.newsserver.mcp.dto;

/**
 * Response DTO for the getFetchStatus tool.
 */
public record FetchStatusResponse(
        boolean success,
        /** IDLE or RUNNING. */
        String state,
        /** Unix seconds of the last sweep start, 0 if there never was one. */
        long lastFetchTime,
        String lastFetchTimeIso,
        long indexedArticles,
        String error
) {
    public static FetchStatusResponse success(final String state, final long lastFetchTime,
                                              final String lastFetchTimeIso, final long indexedArticles) {
        return new FetchStatusResponse(true, state, lastFetchTime, lastFetchTimeIso, indexedArticles, null);
    }

    public static FetchStatusResponse error(final String errorMessage) {
        return new FetchStatusResponse(false, null, 0, null, 0, errorMessage);
    }
}
