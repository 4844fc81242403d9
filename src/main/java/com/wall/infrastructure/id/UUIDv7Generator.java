package com.wall.infrastructure.id;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import com.wall.application.port.out.IdGenerator;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Time-ordered ids for posts and comments. Within one millisecond the generator keeps ids monotonic,
 * which makes them a stable tiebreaker for equal creation timestamps.
 */
@Component
public class UUIDv7Generator implements IdGenerator {

    private final TimeBasedEpochGenerator generator;

    public UUIDv7Generator() {
        this.generator = Generators.timeBasedEpochGenerator();
    }

    @Override
    public UUID generate() {
        return generator.generate();
    }
}
