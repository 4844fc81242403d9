package com.wall.domain.model;

import com.wall.domain.error.ValidationError;

/**
 * Display names for anonymous authors. There are no accounts: whatever the client sends is shown as-is.
 */
public final class AuthorName {

    public static final String DEFAULT = "Guest";
    public static final int MAX_LENGTH = 80;

    private AuthorName() {}

    /**
     * Trims the supplied name, falling back to {@link #DEFAULT} when it is absent or blank.
     */
    public static Result<String, ValidationError> normalize(String value) {
        if (value == null || value.isBlank()) {
            return Result.success(DEFAULT);
        }
        String trimmed = value.trim();
        if (trimmed.length() > MAX_LENGTH) {
            return Result.failure(new ValidationError.AuthorNameTooLong(trimmed.length(), MAX_LENGTH));
        }
        return Result.success(trimmed);
    }
}
