package com.forum.domain.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Explicit assertion that a user has seen a discussion's activity up to {@code readAt}.
 * One row per (user, discussion), overwritten on every view.
 */
public record ReadMark(
    UserId userId,
    UUID discussionId,
    Instant readAt
) {}
