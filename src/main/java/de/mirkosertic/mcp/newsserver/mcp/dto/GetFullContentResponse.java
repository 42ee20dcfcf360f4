package de.mirkosertic.mcp.newsserver.mcp.dto;

public record GetFullContentResponse(
        boolean success,
        String url,
        String title,
        String content,
        String publishedDate,
        String error
) {
    public static GetFullContentResponse success(final String url, final String title,
                                                 final String content, final String publishedDate) {
        return new GetFullContentResponse(true, url, title, content, publishedDate, null);
    }

    public static GetFullContentResponse error(final String errorMessage) {
        return new GetFullContentResponse(false, null, null, null, null, errorMessage);
    }
}
