package com.wall.infrastructure.exception;

/**
 * Raised by feed cache adapters when the backing store cannot be read or written.
 * Never surfaced to clients: services count it and continue without the cache.
 */
public class FeedCacheException extends RuntimeException {

    public FeedCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
