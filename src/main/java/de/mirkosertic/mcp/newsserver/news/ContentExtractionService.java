package de.mirkosertic.mcp.newsserver.news;

import de.mirkosertic.mcp.newsserver.provider.ExtractResult;
import de.mirkosertic.mcp.newsserver.provider.ExtractionProvider;
import de.mirkosertic.mcp.newsserver.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fetches the full content of a single page from the live provider. Results are not cached.
 */
public class ContentExtractionService {

    private static final Logger logger = LoggerFactory.getLogger(ContentExtractionService.class);

    private final ExtractionProvider extractionProvider;

    public ContentExtractionService(final ExtractionProvider extractionProvider) {
        this.extractionProvider = extractionProvider;
    }

    public ExtractedContent extract(final String url) throws ProviderException {
        if (url == null || url.isBlank()) {
            throw new ValidationException("URL is required");
        }

        final List<ExtractResult> results = extractionProvider.extract(List.of(url));
        if (results == null || results.isEmpty()) {
            throw new ProviderException("No content found for the provided URL");
        }

        final ExtractResult first = results.get(0);
        logger.info("Extracted {} characters from {}", first.content().length(), url);
        return new ExtractedContent(url, first.title(), first.content(), first.publishedDate());
    }
}
