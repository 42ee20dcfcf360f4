package de.mirkosertic.mcp.newsserver.provider;

import java.io.IOException;

/**
 * A live search or extraction call failed or returned nothing usable.
 */
public class ProviderException extends IOException {

    public ProviderException(final String message) {
        super(message);
    }

    public ProviderException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
