package de.mirkosertic.mcp.newsserver.news;

/**
 * Required caller input is missing or malformed.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(final String message) {
        super(message);
    }
}
