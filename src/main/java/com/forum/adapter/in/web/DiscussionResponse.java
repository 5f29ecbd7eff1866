package com.forum.adapter.in.web;

import com.forum.domain.model.Discussion;
import com.forum.domain.model.ReadStatus;
import com.forum.domain.model.Script;

import java.time.Instant;
import java.util.UUID;

/**
 * @param read {@code read} or {@code unread} for the viewer; null for anonymous viewers and outside listings
 */
public record DiscussionResponse(
    UUID id,
    String posterId,
    String title,
    String category,
    Long scriptId,
    String moderationState,
    Instant lastActivityAt,
    Instant createdAt,
    String read
) {
    public static DiscussionResponse from(Discussion discussion) {
        return from(discussion, null);
    }

    public static DiscussionResponse from(Discussion discussion, ReadStatus readStatus) {
        return new DiscussionResponse(
            discussion.id(),
            discussion.posterId().toString(),
            discussion.title(),
            discussion.category().categoryKey(),
            discussion.scriptRef().map(Script::id).orElse(null),
            discussion.moderationState().code(),
            discussion.lastActivityAt(),
            discussion.createdAt(),
            readStatus != null ? readStatus.param() : null
        );
    }
}
