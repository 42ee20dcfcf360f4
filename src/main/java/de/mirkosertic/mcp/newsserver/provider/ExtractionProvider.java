package de.mirkosertic.mcp.newsserver.provider;

import java.util.List;

/**
 * Live provider for full-page content.
 */
public interface ExtractionProvider {

    List<ExtractResult> extract(List<String> urls) throws ProviderException;
}
