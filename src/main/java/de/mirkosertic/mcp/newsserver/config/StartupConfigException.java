package de.mirkosertic.mcp.newsserver.config;

/**
 * Required configuration is missing or invalid. Fatal at startup.
 */
public class StartupConfigException extends IllegalStateException {

    public StartupConfigException(final String message) {
        super(message);
    }
}
