package com.forum.domain.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

/**
 * Keyset position in a listing ordered by last activity (newest first), ties broken by id.
 */
public record ActivityCursor(Instant lastActivityAt, UUID discussionId) {

    private static final String SEPARATOR = "|";

    public static ActivityCursor after(Discussion discussion) {
        return new ActivityCursor(discussion.lastActivityAt(), discussion.id());
    }

    public String encode() {
        String raw = lastActivityAt.toString() + SEPARATOR + discussionId;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decodes a client-supplied cursor. Anything unreadable yields empty, which restarts from the top.
     */
    public static Optional<ActivityCursor> decode(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return Optional.empty();
        }
        try {
            String raw = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
            int split = raw.indexOf(SEPARATOR);
            if (split < 0) {
                return Optional.empty();
            }
            return Optional.of(new ActivityCursor(
                Instant.parse(raw.substring(0, split)),
                UUID.fromString(raw.substring(split + 1))
            ));
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }
}
