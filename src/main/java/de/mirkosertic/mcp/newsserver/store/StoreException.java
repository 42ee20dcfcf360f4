package de.mirkosertic.mcp.newsserver.store;

import java.io.IOException;

/**
 * Raised when the backing store cannot be read or written. Never retried inside the store.
 */
public class StoreException extends IOException {

    public StoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
