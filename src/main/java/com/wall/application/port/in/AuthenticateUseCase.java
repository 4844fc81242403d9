package com.wall.application.port.in;

import com.wall.domain.model.User;

import java.util.Optional;

public interface AuthenticateUseCase {

    /**
     * Resolves the account behind an access token.
     *
     * @return empty for a malformed, expired or forged token, or one whose account no longer exists
     */
    Optional<User> authenticate(String accessToken);
}
