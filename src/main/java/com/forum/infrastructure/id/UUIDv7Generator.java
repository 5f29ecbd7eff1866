package com.forum.infrastructure.id;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import com.forum.application.port.out.IdGenerator;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Time-ordered ids for discussions, comments and events.
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
