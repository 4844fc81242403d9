package com.wall.application.port.out;

import com.wall.domain.model.PostType;

import java.util.function.Supplier;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementPostsCreated(PostType type);

    void incrementCommentsCreated();

    void incrementFeedRequests();

    void incrementFeedCacheHits();

    void incrementFeedCacheMisses();

    /**
     * @param operation the cache call that failed: key, get, put or invalidate
     */
    void incrementFeedCacheErrors(String operation);

    <T> T recordWriteDuration(String handler, Supplier<T> operation);

    <T> T recordFeedReadDuration(Supplier<T> operation);
}
