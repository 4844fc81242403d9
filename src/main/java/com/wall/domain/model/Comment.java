package com.wall.domain.model;

import com.wall.domain.error.ValidationError;
import com.wall.domain.error.ValidationError.CommentValidationError;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

public record Comment(
    UUID id,
    UUID postId,
    String body,
    String authorName,
    Instant createdAt
) {
    public static final int MAX_BODY_LENGTH = 5000;

    /**
     * Creates a Comment, returning a Result for expected validation failures.
     * Whether the post exists is checked by the service, not here.
     */
    public static Result<Comment, ValidationError> create(UUID id, UUID postId, String body, String authorName) {
        if (body == null || body.isBlank()) {
            return Result.failure(CommentValidationError.EmptyBody.INSTANCE);
        }
        String trimmed = body.trim();
        if (trimmed.length() > MAX_BODY_LENGTH) {
            return Result.failure(new CommentValidationError.BodyTooLong(trimmed.length(), MAX_BODY_LENGTH));
        }
        var author = AuthorName.normalize(authorName);
        if (author.isFailure()) {
            return Result.failure(author.errorOrNull());
        }
        return Result.success(new Comment(
            id, postId, trimmed, author.getOrThrow(), Instant.now().truncatedTo(ChronoUnit.MICROS)));
    }
}
