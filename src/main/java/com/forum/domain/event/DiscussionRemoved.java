package com.forum.domain.event;

import com.forum.domain.model.UserId;

import java.time.Instant;
import java.util.UUID;

public record DiscussionRemoved(
    UUID eventId,
    UUID discussionId,
    UserId moderatorId,
    Instant occurredAt
) implements DomainEvent {

    public static DiscussionRemoved from(UUID eventId, UUID discussionId, UserId moderatorId) {
        return new DiscussionRemoved(eventId, discussionId, moderatorId, Instant.now());
    }

    @Override
    public String aggregateId() {
        return discussionId.toString();
    }

    @Override
    public String eventType() {
        return "DISCUSSION_REMOVED";
    }
}
