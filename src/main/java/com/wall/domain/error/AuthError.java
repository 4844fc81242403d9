package com.wall.domain.error;

/**
 * Sealed type representing expected business errors for registration and login.
 */
public sealed interface AuthError {

    record ValidationFailed(ValidationError error) implements AuthError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    record UserAlreadyExists() implements AuthError {
        public static final UserAlreadyExists INSTANCE = new UserAlreadyExists();

        @Override
        public String message() {
            return "Username or email already exists";
        }

        @Override
        public String code() {
            return "USER_EXISTS";
        }
    }

    /**
     * Unknown username and wrong password look the same to the caller.
     */
    record InvalidCredentials() implements AuthError {
        public static final InvalidCredentials INSTANCE = new InvalidCredentials();

        @Override
        public String message() {
            return "Invalid credentials";
        }

        @Override
        public String code() {
            return "INVALID_CREDENTIALS";
        }
    }

    String message();

    String code();
}
