package de.mirkosertic.mcp.newsserver.news;

import de.mirkosertic.mcp.newsserver.config.ApplicationConfig;
import de.mirkosertic.mcp.newsserver.provider.ProviderException;
import de.mirkosertic.mcp.newsserver.provider.SearchOptions;
import de.mirkosertic.mcp.newsserver.provider.SearchProvider;
import de.mirkosertic.mcp.newsserver.provider.SearchResult;
import de.mirkosertic.mcp.newsserver.store.Article;
import de.mirkosertic.mcp.newsserver.store.ArticleStore;
import de.mirkosertic.mcp.newsserver.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically sweeps the configured topic queries against the live search provider and stores
 * every result that is not already cached.
 * <p>
 * Only one sweep runs at a time. A sweep requested while another is running returns
 * {@link FetchSummary#skipped()} immediately, it is not queued.
 * <p>
 * The last-fetch marker is written when a sweep starts, not when it completes, so a sweep that
 * dies halfway is not retried before the next scheduled run.
 */
public class NewsIngestionScheduler {

    private static final Logger logger = LoggerFactory.getLogger(NewsIngestionScheduler.class);

    public enum SchedulerState {
        IDLE,
        RUNNING
    }

    private final ApplicationConfig config;
    private final ArticleStore store;
    private final DeduplicationGate deduplicationGate;
    private final SearchProvider searchProvider;
    private final ArticleFactory articleFactory;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ScheduledExecutorService scheduler =
            Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "news-fetcher");
                t.setDaemon(true);
                return t;
            });

    private volatile ScheduledFuture<?> scheduledFetch;

    public NewsIngestionScheduler(
            final ApplicationConfig config,
            final ArticleStore store,
            final DeduplicationGate deduplicationGate,
            final SearchProvider searchProvider,
            final ArticleFactory articleFactory,
            final Clock clock) {
        this.config = config;
        this.store = store;
        this.deduplicationGate = deduplicationGate;
        this.searchProvider = searchProvider;
        this.articleFactory = articleFactory;
        this.clock = clock;
    }

    /**
     * Schedule the recurring sweep. The first run happens after the configured initial delay.
     */
    public void start() {
        if (!config.isFetcherEnabled()) {
            logger.info("Scheduled news fetching is disabled");
            return;
        }
        if (scheduledFetch != null) {
            logger.warn("News fetcher already scheduled");
            return;
        }

        final long intervalMs = TimeUnit.MINUTES.toMillis(config.getFetchIntervalMinutes());
        scheduledFetch = scheduler.scheduleAtFixedRate(
                this::runScheduledFetch,
                config.getInitialFetchDelayMs(),
                intervalMs,
                TimeUnit.MILLISECONDS);

        logger.info("News fetcher scheduled: initialDelay={}ms, interval={}min, {} queries",
                config.getInitialFetchDelayMs(), config.getFetchIntervalMinutes(), config.getQueries().size());
    }

    private void runScheduledFetch() {
        logger.info("Running scheduled news fetch...");
        try {
            fetchLatestNews();
        } catch (final StoreException e) {
            logger.error("Scheduled news fetch failed", e);
        } catch (final RuntimeException e) {
            // An escaping exception would cancel all further scheduled runs
            logger.error("Unexpected error in scheduled news fetch", e);
        }
    }

    /**
     * Run one sweep in the calling thread.
     *
     * @return the sweep outcome, or {@link FetchSummary#skipped()} if a sweep is already running
     * @throws StoreException if the last-fetch marker cannot be read or written
     */
    public FetchSummary fetchLatestNews() throws StoreException {
        if (!running.compareAndSet(false, true)) {
            logger.info("News fetch already in progress, skipping...");
            return FetchSummary.skipped();
        }

        final long startTime = System.nanoTime();
        try {
            logger.info("Fetching latest news for {} queries...", config.getQueries().size());

            final long previousFetchTime = store.lastFetchTime();
            final long fetchTime = clock.instant().getEpochSecond();
            store.recordFetchTime(fetchTime);

            final SearchOptions options = new SearchOptions(
                    config.getFetchSearchDepth(),
                    config.getFetchMaxResults(),
                    config.getTargetWebsites(),
                    config.isFetchIncludeRawContent(),
                    config.getFetchTimeRange(),
                    config.getFetchTopic());

            int processed = 0;
            int failed = 0;
            int stored = 0;
            int duplicates = 0;
            for (final String query : config.getQueries()) {
                try {
                    final QueryOutcome outcome = processQuery(query, options);
                    stored += outcome.stored();
                    duplicates += outcome.duplicates();
                    processed++;
                } catch (final ProviderException | StoreException | RuntimeException e) {
                    failed++;
                    logger.warn("Error processing query '{}': {}", query, e.getMessage(), e);
                }
            }

            final long durationMs = (System.nanoTime() - startTime) / 1_000_000;
            logger.info("Finished fetching latest news in {}ms: {} queries processed, {} failed, {} articles stored, {} duplicates skipped",
                    durationMs, processed, failed, stored, duplicates);

            return new FetchSummary(true, previousFetchTime, fetchTime, processed, failed, stored, duplicates, durationMs);
        } finally {
            running.set(false);
        }
    }

    private record QueryOutcome(int stored, int duplicates) {
    }

    private QueryOutcome processQuery(final String query, final SearchOptions options)
            throws ProviderException, StoreException {
        logger.info("Processing query: {}", query);

        final List<SearchResult> results = searchProvider.search(query, options);

        int stored = 0;
        int duplicates = 0;
        for (final SearchResult result : results) {
            final Article article = articleFactory.create(result);
            if (!deduplicationGate.storeIfNew(article)) {
                logger.debug("Article already exists: {}", result.title());
                duplicates++;
                continue;
            }
            stored++;
            logger.info("Stored article: {}", article.title());
        }
        return new QueryOutcome(stored, duplicates);
    }

    public SchedulerState getState() {
        return running.get() ? SchedulerState.RUNNING : SchedulerState.IDLE;
    }

    /**
     * Cancel the recurring sweep. A sweep in progress runs to completion.
     */
    public void shutdown() {
        logger.info("Shutting down news fetcher");
        final ScheduledFuture<?> future = scheduledFetch;
        if (future != null) {
            future.cancel(false);
            scheduledFetch = null;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("News fetcher did not terminate in time, forcing shutdown");
                scheduler.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for news fetcher to terminate", e);
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
