package de.mirkosertic.mcp.newsserver.news;

import de.mirkosertic.mcp.newsserver.store.Article;
import de.mirkosertic.mcp.newsserver.store.ArticleStore;
import de.mirkosertic.mcp.newsserver.store.StoreException;

/**
 * Decides whether a candidate title is already held by a live article.
 * <p>
 * A duplicate is an exact, case-insensitive title match. Whitespace and punctuation are not
 * normalized. Every check scans all live indexed articles, so the cost is bounded by the
 * index capacity.
 * <p>
 * All producers share one gate and store through {@link #storeIfNew(Article)}, which makes the
 * check and the insert a single step. Two concurrent producers can therefore never both store
 * the same title.
 */
public class DeduplicationGate {

    private final ArticleStore store;
    private final Object storeLock = new Object();

    public DeduplicationGate(final ArticleStore store) {
        this.store = store;
    }

    public boolean isDuplicate(final String candidateTitle) throws StoreException {
        if (candidateTitle == null) {
            return false;
        }
        for (final Article article : store.listAll()) {
            if (candidateTitle.equalsIgnoreCase(article.title())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Store the article unless a live article already has the same title.
     *
     * @return true if the article was stored
     */
    public boolean storeIfNew(final Article article) throws StoreException {
        synchronized (storeLock) {
            if (isDuplicate(article.title())) {
                return false;
            }
            store.put(article);
            return true;
        }
    }
}
