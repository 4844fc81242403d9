package com.wall.adapter.out.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.wall.application.port.out.FeedCache;
import com.wall.domain.model.FeedPage;
import com.wall.infrastructure.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local feed cache for single-instance deployments. Entries expire after the TTL given to
 * {@link #put}; the cache is bounded by {@code app.feed.cache.max-entries}.
 */
@Repository
@ConditionalOnProperty(name = "app.feed.cache.type", havingValue = "memory")
public class InMemoryFeedCache implements FeedCache {

    private final AtomicLong generation = new AtomicLong();
    private final Cache<FeedKey, CachedPage> pages;

    @Autowired
    public InMemoryFeedCache(AppProperties appProperties) {
        this(appProperties.getFeed().getCache().getMaxEntries(), Ticker.systemTicker());
    }

    InMemoryFeedCache(long maxEntries, Ticker ticker) {
        this.pages = Caffeine.newBuilder()
            .maximumSize(maxEntries)
            .expireAfter(new TtlExpiry())
            .ticker(ticker)
            .build();
    }

    @Override
    public FeedKey keyFor(int limit, String cursor) {
        return new FeedKey(generation.get(), limit, cursor);
    }

    @Override
    public Optional<FeedPage> get(FeedKey key) {
        CachedPage cached = pages.getIfPresent(key);
        return cached == null ? Optional.empty() : Optional.of(cached.page());
    }

    @Override
    public void put(FeedKey key, FeedPage page, Duration ttl) {
        if (key.generation() != generation.get()) {
            return; // issued before an invalidation, unreachable anyway
        }
        pages.put(key, new CachedPage(page, ttl));
    }

    @Override
    public void invalidate(Collection<FeedKey> keys) {
        pages.invalidateAll(keys);
    }

    @Override
    public void invalidateAll() {
        generation.incrementAndGet();
        pages.invalidateAll();
    }

    long size() {
        pages.cleanUp();
        return pages.estimatedSize();
    }

    private record CachedPage(FeedPage page, Duration ttl) {}

    private static final class TtlExpiry implements Expiry<FeedKey, CachedPage> {
        @Override
        public long expireAfterCreate(FeedKey key, CachedPage value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(FeedKey key, CachedPage value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(FeedKey key, CachedPage value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
