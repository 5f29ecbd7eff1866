package com.forum.domain.model;

import java.time.Instant;
import java.util.Optional;

/**
 * A board member.
 *
 * @param readSinceWatermark every discussion whose last activity is at or before this instant counts as
 *                           read for the user, whatever its read marks say; null when never set
 */
public record User(
    UserId id,
    boolean moderator,
    Instant readSinceWatermark,
    Instant createdAt
) {
    public static User create(UserId id) {
        return new User(id, false, null, Instant.now());
    }

    public Optional<Instant> watermark() {
        return Optional.ofNullable(readSinceWatermark);
    }
}
