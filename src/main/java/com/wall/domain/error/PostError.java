package com.wall.domain.error;

/**
 * Sealed type representing expected business errors for post operations at the application layer.
 */
public sealed interface PostError {

    /**
     * Wraps a domain validation error that occurred during post creation.
     */
    record ValidationFailed(ValidationError error) implements PostError {
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
