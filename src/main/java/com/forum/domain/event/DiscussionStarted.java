package com.forum.domain.event;

import com.forum.domain.model.Discussion;
import com.forum.domain.model.UserId;

import java.time.Instant;
import java.util.UUID;

public record DiscussionStarted(
    UUID eventId,
    UUID discussionId,
    UserId posterId,
    String categoryKey,
    Long scriptId,
    String title,
    Instant occurredAt
) implements DomainEvent {

    public static DiscussionStarted from(UUID eventId, Discussion discussion) {
        return new DiscussionStarted(
            eventId,
            discussion.id(),
            discussion.posterId(),
            discussion.category().categoryKey(),
            discussion.scriptRef().map(script -> script.id()).orElse(null),
            discussion.title(),
            discussion.createdAt()
        );
    }

    // Events are keyed by discussion so per-thread ordering survives partitioning
    @Override
    public String aggregateId() {
        return discussionId.toString();
    }

    @Override
    public String eventType() {
        return "DISCUSSION_STARTED";
    }
}
