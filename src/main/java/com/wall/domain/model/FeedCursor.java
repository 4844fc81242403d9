package com.wall.domain.model;

import com.wall.domain.error.ValidationError;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.UUID;

/**
 * Position in the feed: the (createdAt, id) pair of the last post on the previous page.
 * The next page holds posts strictly older than this pair.
 */
public record FeedCursor(Instant createdAt, UUID id) {

    private static final String SEPARATOR = "|";

    public static FeedCursor after(Post post) {
        return new FeedCursor(post.createdAt(), post.id());
    }

    public String encode() {
        String raw = createdAt.toString() + SEPARATOR + id;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes an opaque cursor handed out by a previous page.
     */
    public static Result<FeedCursor, ValidationError> decode(String cursor) {
        try {
            String raw = new String(Base64.getUrlDecoder().decode(cursor.trim()), StandardCharsets.UTF_8);
            int split = raw.indexOf(SEPARATOR);
            if (split < 0) {
                return Result.failure(new ValidationError.InvalidCursor(cursor));
            }
            Instant createdAt = Instant.parse(raw.substring(0, split));
            UUID id = UUID.fromString(raw.substring(split + 1));
            return Result.success(new FeedCursor(createdAt, id));
        } catch (IllegalArgumentException | DateTimeParseException e) {
            return Result.failure(new ValidationError.InvalidCursor(cursor));
        }
    }
}
