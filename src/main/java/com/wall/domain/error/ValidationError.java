package com.wall.domain.error;

/**
 * Sealed type representing domain validation errors.
 * These are expected outcomes of bad client input, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // Post id (path parameter) errors
    sealed interface PostIdError extends ValidationError {

        record Empty() implements PostIdError {
            public static final Empty INSTANCE = new Empty();

            @Override
            public String message() {
                return "Post ID cannot be empty";
            }

            @Override
            public String code() {
                return "POST_ID_EMPTY";
            }
        }

        record InvalidFormat(String value) implements PostIdError {
            @Override
            public String message() {
                return "Post ID must be a valid UUID: " + value;
            }

            @Override
            public String code() {
                return "POST_ID_INVALID";
            }
        }
    }

    sealed interface PostValidationError extends ValidationError {

        record InvalidType(String value) implements PostValidationError {
            @Override
            public String message() {
                return value == null || value.isBlank()
                    ? "Post type is required (text, link or photo)"
                    : "Unknown post type '" + value + "' (expected text, link or photo)";
            }

            @Override
            public String code() {
                return "POST_TYPE_INVALID";
            }
        }

        record EmptyTitle() implements PostValidationError {
            public static final EmptyTitle INSTANCE = new EmptyTitle();

            @Override
            public String message() {
                return "Post title cannot be empty";
            }

            @Override
            public String code() {
                return "POST_TITLE_EMPTY";
            }
        }

        record TitleTooLong(int length, int maxLength) implements PostValidationError {
            @Override
            public String message() {
                return "Post title exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "POST_TITLE_TOO_LONG";
            }
        }

        record MissingBody() implements PostValidationError {
            public static final MissingBody INSTANCE = new MissingBody();

            @Override
            public String message() {
                return "body is required for text posts";
            }

            @Override
            public String code() {
                return "POST_BODY_REQUIRED";
            }
        }

        record BodyTooLong(int length, int maxLength) implements PostValidationError {
            @Override
            public String message() {
                return "Post body exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "POST_BODY_TOO_LONG";
            }
        }

        record MissingUrl(String field, String type) implements PostValidationError {
            @Override
            public String message() {
                return field + " is required for " + type + " posts";
            }

            @Override
            public String code() {
                return "POST_URL_REQUIRED";
            }
        }

        record InvalidUrl(String field, String value) implements PostValidationError {
            @Override
            public String message() {
                return field + " must be an absolute http(s) URL of at most 2048 characters";
            }

            @Override
            public String code() {
                return "POST_URL_INVALID";
            }
        }
    }

    sealed interface CommentValidationError extends ValidationError {

        record EmptyBody() implements CommentValidationError {
            public static final EmptyBody INSTANCE = new EmptyBody();

            @Override
            public String message() {
                return "Comment body cannot be empty";
            }

            @Override
            public String code() {
                return "COMMENT_BODY_EMPTY";
            }
        }

        record BodyTooLong(int length, int maxLength) implements CommentValidationError {
            @Override
            public String message() {
                return "Comment body exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "COMMENT_BODY_TOO_LONG";
            }
        }
    }

    sealed interface UserValidationError extends ValidationError {

        record InvalidEmail(String value) implements UserValidationError {
            @Override
            public String message() {
                return "A valid email address of at most 320 characters is required";
            }

            @Override
            public String code() {
                return "USER_EMAIL_INVALID";
            }
        }

        record InvalidUsername(int length, int minLength, int maxLength) implements UserValidationError {
            @Override
            public String message() {
                return "Username must be " + minLength + " to " + maxLength + " characters without spaces (was "
                    + length + ")";
            }

            @Override
            public String code() {
                return "USER_USERNAME_INVALID";
            }
        }

        record InvalidPassword(int minLength, int maxLength) implements UserValidationError {
            @Override
            public String message() {
                return "Password must be " + minLength + " to " + maxLength + " characters";
            }

            @Override
            public String code() {
                return "USER_PASSWORD_INVALID";
            }
        }
    }

    // Shared by posts and comments
    record AuthorNameTooLong(int length, int maxLength) implements ValidationError {
        @Override
        public String message() {
            return "Author name exceeds " + maxLength + " characters (was " + length + ")";
        }

        @Override
        public String code() {
            return "AUTHOR_NAME_TOO_LONG";
        }
    }

    record InvalidCursor(String cursor) implements ValidationError {
        @Override
        public String message() {
            return "Invalid cursor";
        }

        @Override
        public String code() {
            return "INVALID_CURSOR";
        }
    }
}
