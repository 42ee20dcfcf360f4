package de.mirkosertic.mcp.newsserver.news;

import de.mirkosertic.mcp.newsserver.config.ApplicationConfig;
import de.mirkosertic.mcp.newsserver.provider.ProviderException;
import de.mirkosertic.mcp.newsserver.provider.SearchDepth;
import de.mirkosertic.mcp.newsserver.provider.SearchOptions;
import de.mirkosertic.mcp.newsserver.provider.SearchProvider;
import de.mirkosertic.mcp.newsserver.provider.SearchResult;
import de.mirkosertic.mcp.newsserver.store.Article;
import de.mirkosertic.mcp.newsserver.store.ArticleStore;
import de.mirkosertic.mcp.newsserver.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Answers a search from the article cache when it holds enough matches, otherwise from the
 * live provider.
 * <p>
 * The cache matches on case-insensitive substrings of title, content and summary. When fewer
 * than {@code maxResults} articles match, the live provider is queried against the configured
 * domain allow-list, new results are stored, and only the provider's results are returned.
 */
public class RetrievalResolver {

    private static final Logger logger = LoggerFactory.getLogger(RetrievalResolver.class);

    private final ApplicationConfig config;
    private final ArticleStore store;
    private final DeduplicationGate deduplicationGate;
    private final SearchProvider searchProvider;
    private final ArticleFactory articleFactory;

    public RetrievalResolver(
            final ApplicationConfig config,
            final ArticleStore store,
            final DeduplicationGate deduplicationGate,
            final SearchProvider searchProvider,
            final ArticleFactory articleFactory) {
        this.config = config;
        this.store = store;
        this.deduplicationGate = deduplicationGate;
        this.searchProvider = searchProvider;
        this.articleFactory = articleFactory;
    }

    public ResolvedResults resolve(final String query, final int maxResults, final SearchDepth searchDepth)
            throws StoreException, ProviderException {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query is required");
        }
        if (maxResults <= 0) {
            throw new ValidationException("maxResults must be positive");
        }

        final List<Article> cached = searchCache(query, maxResults);
        if (cached.size() >= maxResults) {
            logger.info("Found {} results in cache for query: {}", cached.size(), query);
            return new ResolvedResults(Origin.CACHE, query, cached);
        }

        logger.info("Only {} of {} results in cache, falling back to live search for query: {}",
                cached.size(), maxResults, query);

        final SearchOptions options = new SearchOptions(
                searchDepth,
                maxResults,
                config.getTargetWebsites(),
                false,
                null,
                null);
        final List<SearchResult> results = searchProvider.search(query, options);

        final List<Article> live = new ArrayList<>(results.size());
        int stored = 0;
        for (final SearchResult result : results) {
            final Article article = articleFactory.create(result);
            live.add(article);
            if (deduplicationGate.storeIfNew(article)) {
                stored++;
            }
        }

        logger.info("Live search returned {} results for query '{}', {} new articles stored",
                live.size(), query, stored);
        return new ResolvedResults(Origin.LIVE, query, live);
    }

    /**
     * Live articles containing the query in title, content or summary, newest first.
     */
    List<Article> searchCache(final String query, final int limit) throws StoreException {
        final String needle = query.toLowerCase(Locale.ROOT);
        final List<Article> matches = new ArrayList<>();
        for (final Article article : store.listAll()) {
            if (contains(article.title(), needle)
                    || contains(article.content(), needle)
                    || contains(article.summary(), needle)) {
                matches.add(article);
                if (matches.size() >= limit) {
                    break;
                }
            }
        }
        return matches;
    }

    private static boolean contains(final String text, final String lowerNeedle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }
}
