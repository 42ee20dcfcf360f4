package de.mirkosertic.mcp.newsserver.news;

import java.util.Locale;

/**
 * Where a resolved result set came from.
 */
public enum Origin {
    CACHE,
    LIVE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
