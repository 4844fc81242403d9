package com.wall.adapter.out.cache;

import com.wall.application.port.out.FeedCache;
import com.wall.domain.model.FeedPage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;

/**
 * Caching switched off: every feed request is a miss served from the database.
 */
@Repository
@ConditionalOnProperty(name = "app.feed.cache.type", havingValue = "none")
public class NoOpFeedCache implements FeedCache {

    @Override
    public FeedKey keyFor(int limit, String cursor) {
        return new FeedKey(0, limit, cursor);
    }

    @Override
    public Optional<FeedPage> get(FeedKey key) {
        return Optional.empty();
    }

    @Override
    public void put(FeedKey key, FeedPage page, Duration ttl) {
        // nothing to store
    }

    @Override
    public void invalidate(Collection<FeedKey> keys) {
        // nothing cached
    }

    @Override
    public void invalidateAll() {
        // nothing cached
    }
}
