package com.wall.adapter.out.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wall.application.port.out.FeedCache;
import com.wall.domain.model.FeedPage;
import com.wall.infrastructure.exception.FeedCacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Feed pages as JSON strings in Redis. Pages of older generations are never read again and
 * disappear with their TTL.
 */
@Repository
@ConditionalOnProperty(name = "app.feed.cache.type", havingValue = "redis", matchIfMissing = true)
public class RedisFeedCache implements FeedCache {

    private static final Logger log = LoggerFactory.getLogger(RedisFeedCache.class);

    static final String GENERATION_KEY = "feed:generation";
    static final String PAGE_KEY_PREFIX = "feed:page:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisFeedCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public FeedKey keyFor(int limit, String cursor) {
        try {
            String generation = redisTemplate.opsForValue().get(GENERATION_KEY);
            return new FeedKey(generation == null ? 0 : Long.parseLong(generation), limit, cursor);
        } catch (DataAccessException | NumberFormatException e) {
            throw new FeedCacheException("Failed to read feed cache generation", e);
        }
    }

    @Override
    public Optional<FeedPage> get(FeedKey key) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(pageKey(key));
        } catch (DataAccessException e) {
            throw new FeedCacheException("Failed to read feed page " + key.asString(), e);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, FeedPage.class));
        } catch (JsonProcessingException e) {
            throw new FeedCacheException("Unreadable feed page " + key.asString(), e);
        }
    }

    @Override
    public void put(FeedKey key, FeedPage page, Duration ttl) {
        try {
            String json = objectMapper.writeValueAsString(page);
            redisTemplate.opsForValue().set(pageKey(key), json, ttl);
            log.debug("Cached feed page {} (TTL: {})", key.asString(), ttl);
        } catch (JsonProcessingException | DataAccessException e) {
            throw new FeedCacheException("Failed to write feed page " + key.asString(), e);
        }
    }

    @Override
    public void invalidate(Collection<FeedKey> keys) {
        if (keys.isEmpty()) {
            return;
        }
        List<String> pageKeys = keys.stream().map(this::pageKey).toList();
        try {
            Long removed = redisTemplate.delete(pageKeys);
            log.debug("Evicted {} of {} feed pages", removed, pageKeys.size());
        } catch (DataAccessException e) {
            throw new FeedCacheException("Failed to evict " + pageKeys.size() + " feed pages", e);
        }
    }

    @Override
    public void invalidateAll() {
        try {
            Long generation = redisTemplate.opsForValue().increment(GENERATION_KEY);
            log.debug("Feed cache generation advanced to {}", generation);
        } catch (DataAccessException e) {
            throw new FeedCacheException("Failed to advance feed cache generation", e);
        }
    }

    private String pageKey(FeedKey key) {
        return PAGE_KEY_PREFIX + key.asString();
    }
}
