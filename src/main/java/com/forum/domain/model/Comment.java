package com.forum.domain.model;

import com.forum.domain.error.ValidationError.CommentValidationError;

import java.time.Instant;
import java.util.UUID;

public record Comment(
    UUID id,
    UUID discussionId,
    UserId posterId,
    String text,
    Instant createdAt
) {
    public static final int MAX_TEXT_LENGTH = 10_000;

    /**
     * Creates a Comment, returning a Result for expected validation failures.
     */
    public static Result<Comment, CommentValidationError> create(UUID id, UUID discussionId, UserId posterId, String text) {
        if (text == null || text.isBlank()) {
            return Result.failure(CommentValidationError.EmptyText.INSTANCE);
        }
        String trimmed = text.trim();
        if (trimmed.length() > MAX_TEXT_LENGTH) {
            return Result.failure(new CommentValidationError.TextTooLong(trimmed.length(), MAX_TEXT_LENGTH));
        }
        return Result.success(new Comment(id, discussionId, posterId, trimmed, Instant.now()));
    }
}
