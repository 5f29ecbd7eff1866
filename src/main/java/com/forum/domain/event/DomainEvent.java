package com.forum.domain.event;

import java.time.Instant;
import java.util.UUID;

public sealed interface DomainEvent permits DiscussionStarted, CommentPosted, DiscussionRemoved {
    UUID eventId();
    String aggregateId();
    Instant occurredAt();
    String eventType();
}
