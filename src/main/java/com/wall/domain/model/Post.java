package com.wall.domain.model;

import com.wall.domain.error.ValidationError;
import com.wall.domain.error.ValidationError.PostIdError;
import com.wall.domain.error.ValidationError.PostValidationError;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.UUID;

/**
 * A wall post. Immutable once created, except for {@code commentCount} which the service maintains.
 */
public record Post(
    UUID id,
    PostType type,
    String title,
    String body,
    String linkUrl,
    String imageUrl,
    String authorName,
    Instant createdAt,
    int commentCount
) {
    public static final int MAX_TITLE_LENGTH = 140;
    public static final int MAX_BODY_LENGTH = 10_000;
    public static final int MAX_URL_LENGTH = 2048;

    /**
     * Creates a Post, returning a Result for expected validation failures.
     * The payload that must be present depends on the type: a body for text, a link URL for link
     * and an image URL for photo posts.
     */
    public static Result<Post, ValidationError> create(
            UUID id,
            PostType type,
            String title,
            String body,
            String linkUrl,
            String imageUrl,
            String authorName) {

        if (title == null || title.isBlank()) {
            return Result.failure(PostValidationError.EmptyTitle.INSTANCE);
        }
        String trimmedTitle = title.trim();
        if (trimmedTitle.length() > MAX_TITLE_LENGTH) {
            return Result.failure(new PostValidationError.TitleTooLong(trimmedTitle.length(), MAX_TITLE_LENGTH));
        }

        String trimmedBody = blankToNull(body);
        if (type == PostType.TEXT && trimmedBody == null) {
            return Result.failure(PostValidationError.MissingBody.INSTANCE);
        }
        if (trimmedBody != null && trimmedBody.length() > MAX_BODY_LENGTH) {
            return Result.failure(new PostValidationError.BodyTooLong(trimmedBody.length(), MAX_BODY_LENGTH));
        }

        String link = blankToNull(linkUrl);
        String image = blankToNull(imageUrl);
        if (type == PostType.LINK && link == null) {
            return Result.failure(new PostValidationError.MissingUrl("link_url", type.wireName()));
        }
        if (type == PostType.PHOTO && image == null) {
            return Result.failure(new PostValidationError.MissingUrl("image_url", type.wireName()));
        }
        if (link != null && !isHttpUrl(link)) {
            return Result.failure(new PostValidationError.InvalidUrl("link_url", link));
        }
        if (image != null && !isHttpUrl(image)) {
            return Result.failure(new PostValidationError.InvalidUrl("image_url", image));
        }

        var author = AuthorName.normalize(authorName);
        if (author.isFailure()) {
            return Result.failure(author.errorOrNull());
        }

        return Result.success(new Post(
            id,
            type,
            trimmedTitle,
            trimmedBody,
            link,
            image,
            author.getOrThrow(),
            Instant.now().truncatedTo(ChronoUnit.MICROS), // column precision
            0
        ));
    }

    /**
     * Parses a post id taken from a request path.
     */
    public static Result<UUID, PostIdError> parseId(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(PostIdError.Empty.INSTANCE);
        }
        try {
            return Result.success(UUID.fromString(value.trim()));
        } catch (IllegalArgumentException e) {
            return Result.failure(new PostIdError.InvalidFormat(value));
        }
    }

    public Post withCommentCount(int count) {
        return new Post(id, type, title, body, linkUrl, imageUrl, authorName, createdAt, count);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static boolean isHttpUrl(String value) {
        if (value.length() > MAX_URL_LENGTH) {
            return false;
        }
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            return scheme != null
                && (scheme.toLowerCase(Locale.ROOT).equals("http") || scheme.toLowerCase(Locale.ROOT).equals("https"))
                && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
