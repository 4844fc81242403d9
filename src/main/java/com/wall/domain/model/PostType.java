package com.wall.domain.model;

import com.wall.domain.error.ValidationError.PostValidationError;

import java.util.Locale;

public enum PostType {
    TEXT("text"),
    LINK("link"),
    PHOTO("photo");

    private final String wireName;

    PostType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Lowercase name used on the wire and in the {@code posts.type} column.
     */
    public String wireName() {
        return wireName;
    }

    public static Result<PostType, PostValidationError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(new PostValidationError.InvalidType(value));
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PostType type : values()) {
            if (type.wireName.equals(normalized)) {
                return Result.success(type);
            }
        }
        return Result.failure(new PostValidationError.InvalidType(value));
    }

    /**
     * Maps a stored column value back to the enum. Values come from our own writes.
     *
     * @throws IllegalStateException if the value is unknown (indicates data corruption)
     */
    public static PostType fromTrusted(String value) {
        for (PostType type : values()) {
            if (type.wireName.equals(value)) {
                return type;
            }
        }
        throw new IllegalStateException("Corrupted post type in trusted source: " + value);
    }
}
