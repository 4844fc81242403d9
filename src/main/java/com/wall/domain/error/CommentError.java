package com.wall.domain.error;

import java.util.UUID;

/**
 * Sealed type representing expected business errors for comment operations.
 * PostNotFound is determined by querying state, not by domain validation.
 */
public sealed interface CommentError {

    record PostNotFound(UUID postId) implements CommentError {
        @Override
        public String message() {
            return "Post not found: " + postId;
        }

        @Override
        public String code() {
            return "POST_NOT_FOUND";
        }
    }

    record ValidationFailed(ValidationError error) implements CommentError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    String message();

    String code();
}
