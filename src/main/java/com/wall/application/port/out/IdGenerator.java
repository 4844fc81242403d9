package com.wall.application.port.out;

import java.util.UUID;

/**
 * Port for generating unique identifiers.
 * Abstracts ID generation strategy from application services.
 */
public interface IdGenerator {

    /**
     * Generates a new unique identifier.
     * Implementations should ensure time-ordering (e.g., UUIDv7) so ids double as a creation-order tiebreaker.
     */
    UUID generate();
}
