package de.mirkosertic.mcp.newsserver.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.SetParams;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link ArticleStore} backed by Redis.
 * <p>
 * Key layout (with the configured prefix, {@code defi_news:} by default):
 * <ul>
 *   <li>{@code <prefix><id>} - article JSON, written with {@code SET ... EX ttl}</li>
 *   <li>{@code <prefix>index} - sorted set of article ids scored by ingestion timestamp</li>
 *   <li>{@code <prefix>last_fetch} - Unix seconds of the last sweep start</li>
 * </ul>
 * Redis enforces the TTL, so an id that is still indexed may resolve to nothing. Such entries
 * are skipped when listing.
 */
public class RedisArticleStore implements ArticleStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisArticleStore.class);

    static final String INDEX_SUFFIX = "index";
    static final String LAST_FETCH_SUFFIX = "last_fetch";

    private final JedisPooled jedis;
    private final ObjectMapper mapper;
    private final String keyPrefix;
    private final String indexKey;
    private final String lastFetchKey;
    private final long ttlSeconds;
    private final int maxIndexSize;

    public RedisArticleStore(final JedisPooled jedis, final String keyPrefix, final Duration ttl, final int maxIndexSize) {
        if (jedis == null) {
            throw new IllegalArgumentException("jedis must not be null");
        }
        this.jedis = jedis;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
        this.indexKey = this.keyPrefix + INDEX_SUFFIX;
        this.lastFetchKey = this.keyPrefix + LAST_FETCH_SUFFIX;
        this.ttlSeconds = ttl.toSeconds();
        this.maxIndexSize = maxIndexSize;
    }

    /**
     * Open a pooled connection to the given Redis instance.
     */
    public static RedisArticleStore connect(final String host, final int port, final String keyPrefix,
                                            final Duration ttl, final int maxIndexSize) {
        logger.info("Connecting to Redis at {}:{} (keyPrefix={}, ttl={}, maxIndexSize={})",
                host, port, keyPrefix, ttl, maxIndexSize);
        return new RedisArticleStore(new JedisPooled(host, port), keyPrefix, ttl, maxIndexSize);
    }

    private String articleKey(final String id) {
        return keyPrefix + id;
    }

    @Override
    public void put(final Article article) throws StoreException {
        final String json;
        try {
            json = mapper.writeValueAsString(article);
        } catch (final JsonProcessingException e) {
            throw new StoreException("Failed to serialize article " + article.id(), e);
        }

        try {
            jedis.set(articleKey(article.id()), json, SetParams.setParams().ex(ttlSeconds));
            jedis.zadd(indexKey, article.timestamp(), article.id());
            // Keep only the newest maxIndexSize entries
            jedis.zremrangeByRank(indexKey, 0, -(maxIndexSize + 1L));
        } catch (final JedisException e) {
            logger.error("Error storing article {} in Redis", article.id(), e);
            throw new StoreException("Error storing article in Redis: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Article> get(final String id) throws StoreException {
        final String json;
        try {
            json = jedis.get(articleKey(id));
        } catch (final JedisException e) {
            logger.error("Error reading article {} from Redis", id, e);
            throw new StoreException("Error reading article from Redis: " + e.getMessage(), e);
        }
        if (json == null) {
            return Optional.empty();
        }
        return Optional.of(decode(json));
    }

    @Override
    public List<Article> list(final int limit, final int offset) throws StoreException {
        if (limit <= 0) {
            return List.of();
        }
        return resolve(offset, (long) offset + limit - 1);
    }

    @Override
    public List<Article> listAll() throws StoreException {
        return resolve(0, -1);
    }

    private List<Article> resolve(final long start, final long stop) throws StoreException {
        final List<String> values;
        try {
            final List<String> ids = jedis.zrevrange(indexKey, start, stop);
            if (ids == null || ids.isEmpty()) {
                return List.of();
            }
            values = jedis.mget(ids.stream().map(this::articleKey).toArray(String[]::new));
        } catch (final JedisException e) {
            logger.error("Error listing articles from Redis", e);
            throw new StoreException("Error listing articles from Redis: " + e.getMessage(), e);
        }

        final List<Article> articles = new ArrayList<>(values.size());
        for (final String json : values) {
            // Expired while still indexed
            if (json != null) {
                articles.add(decode(json));
            }
        }
        return articles;
    }

    @Override
    public long size() throws StoreException {
        try {
            return jedis.zcard(indexKey);
        } catch (final JedisException e) {
            throw new StoreException("Error reading index size from Redis: " + e.getMessage(), e);
        }
    }

    @Override
    public void recordFetchTime(final long epochSeconds) throws StoreException {
        try {
            jedis.set(lastFetchKey, Long.toString(epochSeconds));
        } catch (final JedisException e) {
            logger.error("Error storing last fetch time in Redis", e);
            throw new StoreException("Error storing last fetch time in Redis: " + e.getMessage(), e);
        }
    }

    @Override
    public long lastFetchTime() throws StoreException {
        final String value;
        try {
            value = jedis.get(lastFetchKey);
        } catch (final JedisException e) {
            logger.error("Error reading last fetch time from Redis", e);
            throw new StoreException("Error reading last fetch time from Redis: " + e.getMessage(), e);
        }
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (final NumberFormatException e) {
            throw new StoreException("Corrupt last fetch time in Redis: " + value, e);
        }
    }

    private Article decode(final String json) throws StoreException {
        try {
            return mapper.readValue(json, Article.class);
        } catch (final JsonProcessingException e) {
            throw new StoreException("Failed to deserialize article: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void close() {
        logger.info("Closing Redis connection pool");
        jedis.close();
    }
}
