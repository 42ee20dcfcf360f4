package de.mirkosertic.mcp.newsserver.provider;

import java.util.List;

/**
 * Live search provider queried by the ingestion sweep and by the cache fallback.
 */
public interface SearchProvider {

    List<SearchResult> search(String query, SearchOptions options) throws ProviderException;
}
