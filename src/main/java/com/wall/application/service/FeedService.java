package com.wall.application.service;

import com.wall.application.port.in.ListPostsUseCase;
import com.wall.application.port.out.FeedCache;
import com.wall.application.port.out.FeedCache.FeedKey;
import com.wall.application.port.out.MetricsPort;
import com.wall.application.port.out.PostRepository;
import com.wall.domain.error.ValidationError;
import com.wall.domain.model.FeedCursor;
import com.wall.domain.model.FeedPage;
import com.wall.domain.model.Post;
import com.wall.domain.model.Result;
import com.wall.infrastructure.config.AppProperties;
import com.wall.infrastructure.exception.FeedCacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Serves feed pages cache-aside: look up the page, otherwise compute it from the database and store it.
 * The cache is optional at every step; any cache failure degrades to a database read.
 */
@Service
public class FeedService implements ListPostsUseCase {

    private static final Logger log = LoggerFactory.getLogger(FeedService.class);

    private final PostRepository postRepository;
    private final FeedCache feedCache;
    private final AppProperties appProperties;
    private final MetricsPort metrics;

    public FeedService(
            PostRepository postRepository,
            FeedCache feedCache,
            AppProperties appProperties,
            MetricsPort metrics) {
        this.postRepository = postRepository;
        this.feedCache = feedCache;
        this.appProperties = appProperties;
        this.metrics = metrics;
    }

    @Override
    public Result<FeedPage, ValidationError> listPosts(Integer limit, String cursor) {
        int effectiveLimit = effectiveLimit(limit);
        String normalizedCursor = cursor == null || cursor.isBlank() ? null : cursor.trim();

        FeedCursor position = null;
        if (normalizedCursor != null) {
            var decoded = FeedCursor.decode(normalizedCursor);
            if (decoded.isFailure()) {
                log.warn("Invalid cursor: {}", normalizedCursor);
                return Result.failure(decoded.errorOrNull());
            }
            position = decoded.getOrThrow();
        }

        metrics.incrementFeedRequests();
        FeedCursor from = position;
        return Result.success(metrics.recordFeedReadDuration(() -> serve(effectiveLimit, normalizedCursor, from)));
    }

    private FeedPage serve(int limit, String cursor, FeedCursor position) {
        FeedKey key = issueKey(limit, cursor);

        Optional<FeedPage> cached = lookup(key);
        if (cached.isPresent()) {
            metrics.incrementFeedCacheHits();
            log.debug("Feed cache hit: limit={}, cursor={}", limit, cursor != null ? "present" : "none");
            return cached.get();
        }

        metrics.incrementFeedCacheMisses();
        FeedPage page = loadPage(position, limit);
        store(key, page);

        log.debug("Feed served from database: posts={}, hasMore={}", page.items().size(), page.hasMore());
        return page;
    }

    private FeedPage loadPage(FeedCursor position, int limit) {
        List<Post> posts = postRepository.findPage(position, limit + 1);

        boolean hasMore = posts.size() > limit;
        if (hasMore) {
            posts = posts.subList(0, limit);
        }

        String nextCursor = hasMore ? FeedCursor.after(posts.get(posts.size() - 1)).encode() : null;
        return FeedPage.of(posts, nextCursor);
    }

    private FeedKey issueKey(int limit, String cursor) {
        try {
            return feedCache.keyFor(limit, cursor);
        } catch (FeedCacheException e) {
            cacheFailed("key", e);
            return null;
        }
    }

    private Optional<FeedPage> lookup(FeedKey key) {
        if (key == null) {
            return Optional.empty();
        }
        try {
            return feedCache.get(key);
        } catch (FeedCacheException e) {
            cacheFailed("get", e);
            return Optional.empty();
        }
    }

    private void store(FeedKey key, FeedPage page) {
        if (key == null) {
            return;
        }
        try {
            feedCache.put(key, page, appProperties.getFeed().getCache().getTtl());
        } catch (FeedCacheException e) {
            cacheFailed("put", e);
        }
    }

    private void cacheFailed(String operation, FeedCacheException e) {
        metrics.incrementFeedCacheErrors(operation);
        log.warn("Feed cache {} failed, continuing without cache: {}", operation, e.getMessage());
    }

    private int effectiveLimit(Integer requested) {
        AppProperties.Feed feed = appProperties.getFeed();
        int size = requested != null ? requested : feed.getDefaultPageSize();
        return Math.max(1, Math.min(size, feed.getMaxPageSize()));
    }
}
