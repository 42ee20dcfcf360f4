package de.mirkosertic.mcp.newsserver.provider;

import java.util.Locale;

public enum SearchDepth {
    BASIC,
    ADVANCED;

    /**
     * Wire value as expected by the provider API.
     */
    public String apiValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup, falling back to the given default for null or blank input.
     */
    public static SearchDepth parse(final String value, final SearchDepth defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return SearchDepth.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
