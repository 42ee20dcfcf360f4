package de.mirkosertic.mcp.newsserver.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link ArticleStore} backed by a Caffeine cache.
 *
 * <p>Articles expire a fixed duration after they were written ({@code expireAfterWrite}).
 * The {@link Ticker} drives expiry so tests can advance time without sleeping.</p>
 *
 * <p>The index orders entries by (timestamp, id), the same order a Redis sorted set uses for
 * members with equal scores. Listing walks it in reverse.</p>
 */
public class InMemoryArticleStore implements ArticleStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryArticleStore.class);

    private record IndexEntry(long timestamp, String id) {
    }

    private static final Comparator<IndexEntry> INDEX_ORDER = Comparator
            .comparingLong(IndexEntry::timestamp)
            .thenComparing(IndexEntry::id);

    private final Cache<String, Article> articles;
    private final NavigableSet<IndexEntry> index = new ConcurrentSkipListSet<>(INDEX_ORDER);
    private final Object indexLock = new Object();
    private final AtomicLong lastFetchTime = new AtomicLong(0);
    private final int maxIndexSize;

    public InMemoryArticleStore(final Duration ttl, final int maxIndexSize) {
        this(ttl, maxIndexSize, Ticker.systemTicker());
    }

    public InMemoryArticleStore(final Duration ttl, final int maxIndexSize, final Ticker ticker) {
        if (maxIndexSize <= 0) {
            throw new IllegalArgumentException("maxIndexSize must be positive");
        }
        this.maxIndexSize = maxIndexSize;
        this.articles = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();

        logger.info("InMemoryArticleStore initialized: ttl={}, maxIndexSize={}", ttl, maxIndexSize);
    }

    @Override
    public void put(final Article article) {
        articles.put(article.id(), article);

        synchronized (indexLock) {
            // An overwrite with a new timestamp must not leave the old rank behind
            index.removeIf(entry -> entry.id().equals(article.id()));
            index.add(new IndexEntry(article.timestamp(), article.id()));
            while (index.size() > maxIndexSize) {
                final IndexEntry evicted = index.pollFirst();
                if (evicted != null) {
                    logger.debug("Evicted article {} from index (capacity {})", evicted.id(), maxIndexSize);
                }
            }
        }
    }

    @Override
    public Optional<Article> get(final String id) {
        return Optional.ofNullable(articles.getIfPresent(id));
    }

    @Override
    public List<Article> list(final int limit) {
        return list(limit, 0);
    }

    @Override
    public List<Article> list(final int limit, final int offset) {
        if (limit <= 0) {
            return List.of();
        }

        final List<Article> result = new ArrayList<>(Math.min(limit, maxIndexSize));
        final Iterator<IndexEntry> it = index.descendingIterator();
        final long end = (long) offset + limit;
        long rank = 0;
        // Offset and limit address index ranks, exactly like ZREVRANGE
        while (it.hasNext() && rank < end) {
            final IndexEntry entry = it.next();
            if (rank >= offset) {
                final Article article = articles.getIfPresent(entry.id());
                if (article != null) {
                    result.add(article);
                }
            }
            rank++;
        }
        return result;
    }

    @Override
    public List<Article> listAll() {
        final List<Article> result = new ArrayList<>();
        final Iterator<IndexEntry> it = index.descendingIterator();
        while (it.hasNext()) {
            final Article article = articles.getIfPresent(it.next().id());
            if (article != null) {
                result.add(article);
            }
        }
        return result;
    }

    @Override
    public long size() {
        return index.size();
    }

    @Override
    public void recordFetchTime(final long epochSeconds) {
        lastFetchTime.set(epochSeconds);
    }

    @Override
    public long lastFetchTime() {
        return lastFetchTime.get();
    }

    @Override
    public void close() {
        articles.invalidateAll();
        index.clear();
    }
}
