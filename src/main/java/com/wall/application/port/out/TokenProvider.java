package com.wall.application.port.out;

import java.util.Optional;
import java.util.UUID;

/**
 * Port for issuing and checking signed access tokens.
 */
public interface TokenProvider {

    String issue(UUID userId);

    /**
     * @return the user id the token was issued for, or empty if the token is invalid or expired
     */
    Optional<UUID> verify(String token);
}
