package com.forum.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * The slice of a discussion read tracking needs: its last activity and the reader's mark, if any.
 */
public record DiscussionActivity(
    UUID discussionId,
    Instant lastActivityAt,
    Instant markReadAt
) {
    public ReadStatus readStatus(Instant watermark) {
        return ReadStatus.of(lastActivityAt, markReadAt, watermark);
    }
}
