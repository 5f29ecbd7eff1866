package com.forum.domain.event;

import com.forum.domain.model.Comment;
import com.forum.domain.model.UserId;

import java.time.Instant;
import java.util.UUID;

public record CommentPosted(
    UUID eventId,
    UUID commentId,
    UUID discussionId,
    UserId posterId,
    Instant occurredAt
) implements DomainEvent {

    public static CommentPosted from(UUID eventId, Comment comment) {
        return new CommentPosted(eventId, comment.id(), comment.discussionId(), comment.posterId(), comment.createdAt());
    }

    @Override
    public String aggregateId() {
        return discussionId.toString();
    }

    @Override
    public String eventType() {
        return "COMMENT_POSTED";
    }
}
