package com.wall.domain.model;

import java.util.List;

/**
 * A bounded, newest-first slice of the wall. Derived from the post table and safe to cache.
 */
public record FeedPage(
    List<Post> items,
    String nextCursor
) {
    public FeedPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static FeedPage of(List<Post> items, String nextCursor) {
        return new FeedPage(items, nextCursor);
    }

    public static FeedPage empty() {
        return new FeedPage(List.of(), null);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
