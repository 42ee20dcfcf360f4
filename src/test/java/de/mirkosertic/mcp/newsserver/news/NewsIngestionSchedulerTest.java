package de.mirkosertic.mcp.newsserver.news;

import de.mirkosertic.mcp.newsserver.config.ApplicationConfig;
import de.mirkosertic.mcp.newsserver.provider.ProviderException;
import de.mirkosertic.mcp.newsserver.provider.SearchDepth;
import de.mirkosertic.mcp.newsserver.provider.SearchOptions;
import de.mirkosertic.mcp.newsserver.provider.SearchProvider;
import de.mirkosertic.mcp.newsserver.provider.SearchResult;
import de.mirkosertic.mcp.newsserver.store.Article;
import de.mirkosertic.mcp.newsserver.store.InMemoryArticleStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("NewsIngestionScheduler Tests")
class NewsIngestionSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private ApplicationConfig config;
    private InMemoryArticleStore store;
    private SearchProvider searchProvider;
    private NewsIngestionScheduler scheduler;

    @BeforeEach
    void setUp() {
        config = mock(ApplicationConfig.class);
        when(config.getQueries()).thenReturn(List.of("ethereum", "defi"));
        when(config.getTargetWebsites()).thenReturn(List.of("coindesk.com", "decrypt.co"));
        when(config.getFetchSearchDepth()).thenReturn(SearchDepth.ADVANCED);
        when(config.getFetchMaxResults()).thenReturn(10);
        when(config.getFetchTimeRange()).thenReturn("week");
        when(config.getFetchTopic()).thenReturn("news");
        when(config.isFetchIncludeRawContent()).thenReturn(true);
        when(config.isFetcherEnabled()).thenReturn(false);

        store = new InMemoryArticleStore(Duration.ofDays(7), 1000);
        searchProvider = mock(SearchProvider.class);
        final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        scheduler = new NewsIngestionScheduler(config, store, new DeduplicationGate(store),
                searchProvider, new ArticleFactory(clock), clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private static SearchResult hit(final String title) {
        return new SearchResult(title, "https://coindesk.com/" + title.hashCode(), "body", "snippet", null, 0.7);
    }

    @Test
    @DisplayName("Should store the same title only once across queries")
    void shouldSkipDuplicateTitles() throws Exception {
        when(searchProvider.search(eq("ethereum"), any())).thenReturn(List.of(hit("ETH Upgrade Live")));
        when(searchProvider.search(eq("defi"), any())).thenReturn(List.of(hit("eth upgrade live"), hit("Aave V4")));

        final FetchSummary summary = scheduler.fetchLatestNews();

        assertThat(summary.started()).isTrue();
        assertThat(summary.queriesProcessed()).isEqualTo(2);
        assertThat(summary.articlesStored()).isEqualTo(2);
        assertThat(summary.duplicatesSkipped()).isEqualTo(1);
        assertThat(store.listAll()).extracting(Article::title)
                .containsExactlyInAnyOrder("ETH Upgrade Live", "Aave V4");
    }

    @Test
    @DisplayName("Should pass configured sweep options to the provider")
    void shouldUseConfiguredOptions() throws Exception {
        when(searchProvider.search(any(), any())).thenReturn(List.of());

        scheduler.fetchLatestNews();

        final ArgumentCaptor<SearchOptions> options = ArgumentCaptor.forClass(SearchOptions.class);
        verify(searchProvider, times(2)).search(any(), options.capture());
        final SearchOptions used = options.getValue();
        assertThat(used.searchDepth()).isEqualTo(SearchDepth.ADVANCED);
        assertThat(used.maxResults()).isEqualTo(10);
        assertThat(used.includeDomains()).containsExactly("coindesk.com", "decrypt.co");
        assertThat(used.includeRawContent()).isTrue();
        assertThat(used.timeRange()).isEqualTo("week");
        assertThat(used.topic()).isEqualTo("news");
    }

    @Test
    @DisplayName("Should continue with the next query when one fails")
    void shouldIsolateQueryFailures() throws Exception {
        when(searchProvider.search(eq("ethereum"), any())).thenThrow(new ProviderException("Tavily API error: code 500"));
        when(searchProvider.search(eq("defi"), any())).thenReturn(List.of(hit("Aave V4")));

        final FetchSummary summary = scheduler.fetchLatestNews();

        assertThat(summary.queriesFailed()).isEqualTo(1);
        assertThat(summary.queriesProcessed()).isEqualTo(1);
        assertThat(summary.articlesStored()).isEqualTo(1);
        assertThat(scheduler.getState()).isEqualTo(NewsIngestionScheduler.SchedulerState.IDLE);
    }

    @Test
    @DisplayName("Should record the fetch time when the sweep starts")
    void shouldRecordFetchTimeAtStart() throws Exception {
        store.recordFetchTime(1_000L);
        when(searchProvider.search(any(), any())).thenAnswer(invocation -> {
            assertThat(store.lastFetchTime()).isEqualTo(NOW.getEpochSecond());
            throw new RuntimeException("boom");
        });

        final FetchSummary summary = scheduler.fetchLatestNews();

        assertThat(summary.previousFetchTime()).isEqualTo(1_000L);
        assertThat(summary.fetchTime()).isEqualTo(NOW.getEpochSecond());
        assertThat(store.lastFetchTime()).isEqualTo(NOW.getEpochSecond());
    }

    @Test
    @DisplayName("Should skip a sweep requested while another is running")
    void shouldNotRunConcurrentSweeps() throws Exception {
        final CountDownLatch inSearch = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        when(searchProvider.search(any(), any())).thenAnswer(invocation -> {
            inSearch.countDown();
            release.await(5, TimeUnit.SECONDS);
            return List.of();
        });

        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            final Future<FetchSummary> first = executor.submit(scheduler::fetchLatestNews);
            assertThat(inSearch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(scheduler.getState()).isEqualTo(NewsIngestionScheduler.SchedulerState.RUNNING);

            final FetchSummary second = scheduler.fetchLatestNews();
            assertThat(second.started()).isFalse();

            release.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS).started()).isTrue();
            assertThat(scheduler.getState()).isEqualTo(NewsIngestionScheduler.SchedulerState.IDLE);
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should not schedule when the fetcher is disabled")
    void shouldNotScheduleWhenDisabled() throws Exception {
        scheduler.start();

        Thread.sleep(100);
        verify(searchProvider, never()).search(any(), any());
    }

    @Test
    @DisplayName("Should run the first scheduled sweep after the initial delay")
    void shouldRunScheduledSweep() throws Exception {
        when(config.isFetcherEnabled()).thenReturn(true);
        when(config.getInitialFetchDelayMs()).thenReturn(10L);
        when(config.getFetchIntervalMinutes()).thenReturn(60L);
        when(searchProvider.search(any(), any())).thenReturn(List.of(hit("Aave V4")));

        scheduler.start();

        verify(searchProvider, timeout(5000).times(2)).search(any(), any());
    }
}
