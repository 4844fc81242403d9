package com.wall.application.port.out;

import com.wall.domain.model.FeedPage;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * Best-effort cache of computed feed pages.
 *
 * Keys are stamped with the cache generation current when they were issued. {@link #invalidateAll()} moves the
 * generation forward, so a page stored under an older key can no longer be found, even when a slow reader stores
 * it after the invalidation.
 *
 * Every method may throw {@link com.wall.infrastructure.exception.FeedCacheException}; callers fall back to the
 * database and never let it reach a client.
 */
public interface FeedCache {

    /**
     * Issues a key for the given pagination parameters under the current generation.
     */
    FeedKey keyFor(int limit, String cursor);

    Optional<FeedPage> get(FeedKey key);

    void put(FeedKey key, FeedPage page, Duration ttl);

    /**
     * Drops the pages stored under the given keys. Other pages, and the generation, are left alone.
     */
    void invalidate(Collection<FeedKey> keys);

    /**
     * Makes every page cached so far unreachable.
     */
    void invalidateAll();

    record FeedKey(long generation, int limit, String cursor) {
        public String asString() {
            return "g" + generation + ":limit=" + limit + ":cursor=" + (cursor == null ? "" : cursor);
        }
    }
}
