package de.mirkosertic.mcp.newsserver.store;

import java.util.List;
import java.util.Optional;

/**
 * Key-value persistence for {@link Article}s with per-item expiry and a time-ordered index.
 * <p>
 * The index is bounded: after every {@link #put(Article)} the oldest entries beyond the
 * configured capacity are dropped. Dropping an index entry does not delete the article itself,
 * it simply stops being listed and expires on its own TTL.
 * <p>
 * Implementations must be safe for concurrent reads and appends.
 */
public interface ArticleStore extends AutoCloseable {

    /**
     * Insert or overwrite the article keyed by its id, set its TTL and add it to the index.
     */
    void put(Article article) throws StoreException;

    /**
     * @return the article, or empty if it does not exist or has expired
     */
    Optional<Article> get(String id) throws StoreException;

    /**
     * Articles in strictly descending timestamp order. Index entries whose article has
     * expired are skipped, so fewer than {@code limit} articles may be returned.
     */
    List<Article> list(int limit, int offset) throws StoreException;

    default List<Article> list(final int limit) throws StoreException {
        return list(limit, 0);
    }

    /**
     * All live indexed articles, newest first.
     */
    List<Article> listAll() throws StoreException;

    /**
     * Number of entries currently held by the index, including entries whose article expired.
     */
    long size() throws StoreException;

    void recordFetchTime(long epochSeconds) throws StoreException;

    /**
     * @return Unix seconds of the last recorded fetch, 0 if never recorded
     */
    long lastFetchTime() throws StoreException;

    @Override
    void close();
}
