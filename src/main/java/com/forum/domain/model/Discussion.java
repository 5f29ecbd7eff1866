package com.forum.domain.model;

import com.forum.domain.error.ValidationError.DiscussionValidationError;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * A top-level thread. {@code lastActivityAt} starts at creation and is bumped by every new comment;
 * it is the timestamp read tracking compares against.
 */
public record Discussion(
    UUID id,
    UserId posterId,
    Script script,
    DiscussionCategory category,
    ModerationState moderationState,
    String title,
    Instant lastActivityAt,
    Instant createdAt
) {
    public static final int MAX_TITLE_LENGTH = 255;

    /**
     * Starts a visible discussion, returning a Result for expected validation failures.
     * Script discussions always go to the script discussions category; others need a non-script category.
     */
    public static Result<Discussion, DiscussionValidationError> start(
            UUID id, UserId posterId, String title, DiscussionCategory category, Script script) {
        if (title == null || title.isBlank()) {
            return Result.failure(DiscussionValidationError.EmptyTitle.INSTANCE);
        }
        String trimmed = title.trim();
        if (trimmed.length() > MAX_TITLE_LENGTH) {
            return Result.failure(new DiscussionValidationError.TitleTooLong(trimmed.length(), MAX_TITLE_LENGTH));
        }
        if (category == null) {
            return Result.failure(DiscussionValidationError.MissingCategory.INSTANCE);
        }
        if (script == null && !category.nonScript()) {
            return Result.failure(new DiscussionValidationError.CategoryRequiresScript(category.categoryKey()));
        }
        Instant now = Instant.now();
        return Result.success(new Discussion(id, posterId, script, category, ModerationState.VISIBLE, trimmed, now, now));
    }

    public Optional<Script> scriptRef() {
        return Optional.ofNullable(script);
    }

    public Discussion withModerationState(ModerationState state) {
        return new Discussion(id, posterId, script, category, state, title, lastActivityAt, createdAt);
    }
}
