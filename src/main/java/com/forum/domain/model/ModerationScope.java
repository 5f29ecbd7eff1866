package com.forum.domain.model;

/**
 * Which moderation states a query lets through.
 */
public sealed interface ModerationScope {

    /**
     * No moderation restriction at all, removed discussions included. Only used for bookkeeping writes
     * such as bulk read marks, never for anything shown to a viewer.
     */
    record Unrestricted() implements ModerationScope {
        public static final Unrestricted INSTANCE = new Unrestricted();
    }

    record VisibleOnly() implements ModerationScope {
        public static final VisibleOnly INSTANCE = new VisibleOnly();
    }

    /**
     * Visible discussions plus every discussion under review (moderators).
     */
    record VisibleOrUnderReview() implements ModerationScope {
        public static final VisibleOrUnderReview INSTANCE = new VisibleOrUnderReview();
    }

    /**
     * Visible discussions plus the poster's own discussions under review.
     */
    record VisibleOrOwnUnderReview(UserId posterId) implements ModerationScope {}
}
