package de.mirkosertic.mcp.newsserver.mcp.dto;

import java.util.List;

public record GetLatestNewsResponse(
        boolean success,
        int count,
        List<NewsItem> results,
        String error
) {
    public static GetLatestNewsResponse success(final List<NewsItem> results) {
        return new GetLatestNewsResponse(true, results.size(), results, null);
    }

    public static GetLatestNewsResponse error(final String errorMessage) {
        return new GetLatestNewsResponse(false, 0, null, errorMessage);
    }
}
