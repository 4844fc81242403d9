package com.wall.application.service;

import com.wall.application.port.out.FeedCache;
import com.wall.application.port.out.MetricsPort;
import com.wall.infrastructure.exception.FeedCacheException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Drops cached feed pages once a write is durable.
 *
 * Invalidating before commit would let a concurrent reader re-cache the pre-write page under the new
 * generation, so inside a transaction the invalidation is deferred to after commit and skipped on rollback.
 */
@Component
public class FeedInvalidator {

    private static final Logger log = LoggerFactory.getLogger(FeedInvalidator.class);

    private final FeedCache feedCache;
    private final MetricsPort metrics;

    public FeedInvalidator(FeedCache feedCache, MetricsPort metrics) {
        this.feedCache = feedCache;
        this.metrics = metrics;
    }

    public void invalidateAfterCommit(String reason) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    invalidateNow(reason);
                }
            });
        } else {
            invalidateNow(reason);
        }
    }

    private void invalidateNow(String reason) {
        try {
            feedCache.invalidateAll();
            log.debug("Feed cache invalidated: reason={}", reason);
        } catch (FeedCacheException e) {
            metrics.incrementFeedCacheErrors("invalidate");
            log.warn("Feed cache invalidation failed (reason={}); stale pages expire with their TTL: {}",
                reason, e.getMessage());
        }
    }
}
