package com.wall.domain.model;

import com.wall.domain.error.ValidationError;
import com.wall.domain.error.ValidationError.UserValidationError;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * A registered account. Posts and comments made while signed in carry the username as their author name.
 */
public record User(
    UUID id,
    String email,
    String username,
    String passwordHash,
    Instant createdAt
) {
    public static final int MAX_EMAIL_LENGTH = 320;
    public static final int MIN_USERNAME_LENGTH = 3;
    public static final int MAX_USERNAME_LENGTH = 50;
    public static final int MIN_PASSWORD_LENGTH = 8;
    public static final int MAX_PASSWORD_LENGTH = 200;

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    public static User create(UUID id, String email, String username, String passwordHash) {
        return new User(id, email, username, passwordHash, Instant.now().truncatedTo(ChronoUnit.MICROS));
    }

    public static Result<String, ValidationError> normalizeEmail(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.length() > MAX_EMAIL_LENGTH || !EMAIL.matcher(trimmed).matches()) {
            return Result.failure(new UserValidationError.InvalidEmail(value));
        }
        // Domains are case-insensitive; the local part is kept as typed
        int at = trimmed.lastIndexOf('@');
        return Result.success(trimmed.substring(0, at) + trimmed.substring(at).toLowerCase());
    }

    public static Result<String, ValidationError> normalizeUsername(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.length() < MIN_USERNAME_LENGTH
                || trimmed.length() > MAX_USERNAME_LENGTH
                || trimmed.chars().anyMatch(Character::isWhitespace)) {
            return Result.failure(new UserValidationError.InvalidUsername(
                trimmed.length(), MIN_USERNAME_LENGTH, MAX_USERNAME_LENGTH));
        }
        return Result.success(trimmed);
    }

    /**
     * Passwords are checked as given, never trimmed.
     */
    public static Result<String, ValidationError> checkPassword(String value) {
        if (value == null || value.length() < MIN_PASSWORD_LENGTH || value.length() > MAX_PASSWORD_LENGTH) {
            return Result.failure(new UserValidationError.InvalidPassword(MIN_PASSWORD_LENGTH, MAX_PASSWORD_LENGTH));
        }
        return Result.success(value);
    }
}
