package com.forum.domain.error;

import java.util.UUID;

/**
 * Sealed type representing expected business errors for discussion operations at the application layer.
 * These errors are determined by querying state (repository), not by domain validation.
 */
public sealed interface DiscussionError {

    /**
     * The discussion does not exist, or exists but is not visible to the viewer.
     */
    record NotFound(UUID discussionId) implements DiscussionError {
        @Override
        public String message() {
            return "Discussion not found: " + discussionId;
        }

        @Override
        public String code() {
            return "DISCUSSION_NOT_FOUND";
        }
    }

    /**
     * Wraps a domain validation error.
     */
    record ValidationFailed(ValidationError error) implements DiscussionError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    String message();

    String code();
}
