package de.mirkosertic.mcp.newsserver.store;

import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryArticleStore Tests")
class InMemoryArticleStoreTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;

    private InMemoryArticleStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryArticleStore(Duration.ofDays(7), 1000, ticker);
    }

    static Article article(final String id, final String title, final long timestamp) {
        return new Article(id, title, "https://example.com/" + id, "content of " + title,
                "summary of " + title, "2024-05-01T00:00:00Z", "example.com", 0.5, timestamp);
    }

    @Test
    @DisplayName("Should return a stored article by id")
    void shouldReturnStoredArticle() {
        final Article a = article("a", "ETH Upgrade Live", 100);
        store.put(a);

        assertThat(store.get("a")).contains(a);
        assertThat(store.get("missing")).isEmpty();
    }

    @Test
    @DisplayName("Should list newest first regardless of insertion order")
    void shouldListNewestFirst() {
        store.put(article("b", "B", 200));
        store.put(article("a", "A", 100));
        store.put(article("c", "C", 300));

        assertThat(store.list(2, 0))
                .extracting(Article::id)
                .containsExactly("c", "b");
        assertThat(store.list(10))
                .extracting(Article::id)
                .containsExactly("c", "b", "a");
    }

    @Test
    @DisplayName("Should apply offset to index ranks")
    void shouldApplyOffset() {
        for (int i = 1; i <= 5; i++) {
            store.put(article("id" + i, "T" + i, i * 10L));
        }

        assertThat(store.list(2, 1))
                .extracting(Article::id)
                .containsExactly("id4", "id3");
        assertThat(store.list(10, 4))
                .extracting(Article::id)
                .containsExactly("id1");
        assertThat(store.list(10, 5)).isEmpty();
        assertThat(store.list(0, 0)).isEmpty();
    }

    @Test
    @DisplayName("Should keep only the newest entries when the index is over capacity")
    void shouldEvictOldestWhenOverCapacity() {
        for (int i = 1; i <= 1001; i++) {
            store.put(article("id" + i, "T" + i, i));
        }

        assertThat(store.size()).isEqualTo(1000);
        final List<Article> all = store.listAll();
        assertThat(all).hasSize(1000);
        assertThat(all).extracting(Article::id).doesNotContain("id1");
        assertThat(all.get(0).id()).isEqualTo("id1001");
    }

    @Test
    @DisplayName("Should trim to a small capacity on every put")
    void shouldTrimSmallIndex() {
        final InMemoryArticleStore small = new InMemoryArticleStore(Duration.ofDays(7), 3, ticker);
        small.put(article("a", "A", 100));
        small.put(article("b", "B", 200));
        small.put(article("c", "C", 300));
        small.put(article("d", "D", 400));
        // Older than everything indexed, dropped right away
        small.put(article("e", "E", 50));

        assertThat(small.size()).isEqualTo(3);
        assertThat(small.list(10))
                .extracting(Article::id)
                .containsExactly("d", "c", "b");
        // Trimmed from the index only, the article itself lives until its TTL
        assertThat(small.get("a")).isPresent();
    }

    @Test
    @DisplayName("Should handle limits near Integer.MAX_VALUE together with an offset")
    void shouldNotOverflowRankRange() {
        store.put(article("a", "A", 100));
        store.put(article("b", "B", 200));
        store.put(article("c", "C", 300));

        assertThat(store.list(Integer.MAX_VALUE, 1))
                .extracting(Article::id)
                .containsExactly("b", "a");
    }

    @Test
    @DisplayName("Should not return articles after their TTL elapsed")
    void shouldExpireArticles() {
        final InMemoryArticleStore shortLived = new InMemoryArticleStore(Duration.ofSeconds(10), 100, ticker);
        shortLived.put(article("a", "A", 100));

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(5));
        assertThat(shortLived.get("a")).isPresent();

        nanos.addAndGet(TimeUnit.SECONDS.toNanos(6));
        assertThat(shortLived.get("a")).isEmpty();
        assertThat(shortLived.list(10)).isEmpty();
        assertThat(shortLived.listAll()).isEmpty();
    }

    @Test
    @DisplayName("Should replace an article written twice under the same id")
    void shouldOverwriteSameId() {
        store.put(article("a", "Old", 100));
        store.put(article("b", "B", 200));
        store.put(article("a", "New", 300));

        assertThat(store.size()).isEqualTo(2);
        assertThat(store.listAll())
                .extracting(Article::title)
                .containsExactly("New", "B");
    }

    @Test
    @DisplayName("Should report 0 as last fetch time until one is recorded")
    void shouldTrackLastFetchTime() {
        assertThat(store.lastFetchTime()).isZero();

        store.recordFetchTime(1_700_000_000L);

        assertThat(store.lastFetchTime()).isEqualTo(1_700_000_000L);
    }

    @Test
    @DisplayName("Should reject a non-positive index capacity")
    void shouldRejectInvalidCapacity() {
        assertThatThrownBy(() -> new InMemoryArticleStore(Duration.ofDays(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
