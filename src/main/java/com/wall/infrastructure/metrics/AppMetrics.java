package com.wall.infrastructure.metrics;

import com.wall.application.port.out.MetricsPort;
import com.wall.domain.model.PostType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

@Component
public class AppMetrics implements MetricsPort {

    static final String POSTS_CREATED = "posts_created_total";
    static final String COMMENTS_CREATED = "comments_created_total";
    static final String FEED_REQUESTS = "feed_requests_total";
    static final String FEED_CACHE_HITS = "feed_cache_hits_total";
    static final String FEED_CACHE_MISSES = "feed_cache_misses_total";
    static final String FEED_CACHE_ERRORS = "feed_cache_errors_total";
    static final String WRITE_DURATION = "api_write_duration_seconds";
    static final String FEED_READ_DURATION = "feed_read_duration_seconds";

    private final MeterRegistry registry;

    private final Map<PostType, Counter> postsCreated;
    private final Counter commentsCreated;
    private final Counter feedRequests;
    private final Counter feedCacheHits;
    private final Counter feedCacheMisses;
    private final Timer feedReadDuration;
    private final Map<String, Counter> feedCacheErrors = new ConcurrentHashMap<>();
    private final Map<String, Timer> writeDurations = new ConcurrentHashMap<>();

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;

        Map<PostType, Counter> byType = new EnumMap<>(PostType.class);
        for (PostType type : PostType.values()) {
            byType.put(type, Counter.builder(POSTS_CREATED)
                .description("Total number of posts created")
                .tag("type", type.wireName())
                .register(registry));
        }
        this.postsCreated = byType;

        this.commentsCreated = Counter.builder(COMMENTS_CREATED)
            .description("Total number of comments created")
            .register(registry);

        this.feedRequests = Counter.builder(FEED_REQUESTS)
            .description("Total number of feed page requests")
            .register(registry);

        this.feedCacheHits = Counter.builder(FEED_CACHE_HITS)
            .description("Feed pages served from the cache")
            .register(registry);

        this.feedCacheMisses = Counter.builder(FEED_CACHE_MISSES)
            .description("Feed pages computed from the database")
            .register(registry);

        this.feedReadDuration = Timer.builder(FEED_READ_DURATION)
            .description("Time taken to serve a feed page")
            .publishPercentileHistogram()
            .register(registry);
    }

    @Override
    public void incrementPostsCreated(PostType type) {
        postsCreated.get(type).increment();
    }

    @Override
    public void incrementCommentsCreated() {
        commentsCreated.increment();
    }

    @Override
    public void incrementFeedRequests() {
        feedRequests.increment();
    }

    @Override
    public void incrementFeedCacheHits() {
        feedCacheHits.increment();
    }

    @Override
    public void incrementFeedCacheMisses() {
        feedCacheMisses.increment();
    }

    @Override
    public void incrementFeedCacheErrors(String operation) {
        feedCacheErrors.computeIfAbsent(operation, op -> Counter.builder(FEED_CACHE_ERRORS)
            .description("Feed cache calls that failed and were bypassed")
            .tag("operation", op)
            .register(registry)
        ).increment();
    }

    @Override
    public <T> T recordWriteDuration(String handler, Supplier<T> operation) {
        Timer timer = writeDurations.computeIfAbsent(handler, h -> Timer.builder(WRITE_DURATION)
            .description("Time taken to handle a write request")
            .tag("handler", h)
            .publishPercentileHistogram()
            .register(registry));
        return timer.record(operation);
    }

    @Override
    public <T> T recordFeedReadDuration(Supplier<T> operation) {
        return feedReadDuration.record(operation);
    }
}
