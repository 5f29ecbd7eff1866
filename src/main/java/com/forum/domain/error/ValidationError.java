package com.forum.domain.error;

/**
 * Sealed type representing domain validation errors.
 * These are expected business outcomes, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    // UserId validation errors
    sealed interface UserIdError extends ValidationError {

        record Empty() implements UserIdError {
            public static final Empty INSTANCE = new Empty();
            @Override
            public String message() {
                return "User ID cannot be empty";
            }

            @Override
            public String code() {
                return "USER_ID_EMPTY";
            }
        }

        record InvalidFormat(String value) implements UserIdError {
            @Override
            public String message() {
                return "User ID must be an integer: " + value;
            }

            @Override
            public String code() {
                return "USER_ID_INVALID_FORMAT";
            }
        }

        record NotPositive(long value) implements UserIdError {
            @Override
            public String message() {
                return "User ID must be positive, was " + value;
            }

            @Override
            public String code() {
                return "USER_ID_NOT_POSITIVE";
            }
        }
    }

    // Discussion validation errors
    sealed interface DiscussionValidationError extends ValidationError {

        record EmptyTitle() implements DiscussionValidationError {
            public static final EmptyTitle INSTANCE = new EmptyTitle();
            @Override
            public String message() {
                return "Discussion title cannot be empty";
            }

            @Override
            public String code() {
                return "DISCUSSION_TITLE_EMPTY";
            }
        }

        record TitleTooLong(int length, int maxLength) implements DiscussionValidationError {
            @Override
            public String message() {
                return "Discussion title exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "DISCUSSION_TITLE_TOO_LONG";
            }
        }

        record MissingCategory() implements DiscussionValidationError {
            public static final MissingCategory INSTANCE = new MissingCategory();
            @Override
            public String message() {
                return "A discussion needs a category or a script";
            }

            @Override
            public String code() {
                return "DISCUSSION_CATEGORY_MISSING";
            }
        }

        record UnknownCategory(String categoryKey) implements DiscussionValidationError {
            @Override
            public String message() {
                return "Unknown discussion category: " + categoryKey;
            }

            @Override
            public String code() {
                return "DISCUSSION_CATEGORY_UNKNOWN";
            }
        }

        record CategoryRequiresScript(String categoryKey) implements DiscussionValidationError {
            @Override
            public String message() {
                return "Category " + categoryKey + " is reserved for script discussions";
            }

            @Override
            public String code() {
                return "DISCUSSION_CATEGORY_REQUIRES_SCRIPT";
            }
        }

        record UnknownScript(long scriptId) implements DiscussionValidationError {
            @Override
            public String message() {
                return "Unknown script: " + scriptId;
            }

            @Override
            public String code() {
                return "SCRIPT_UNKNOWN";
            }
        }

        record InvalidReviewState(String value) implements DiscussionValidationError {
            @Override
            public String message() {
                return "Review state must be 'visible' or 'under_review', was " + value;
            }

            @Override
            public String code() {
                return "DISCUSSION_REVIEW_STATE_INVALID";
            }
        }
    }

    // Comment validation errors
    sealed interface CommentValidationError extends ValidationError {

        record EmptyText() implements CommentValidationError {
            public static final EmptyText INSTANCE = new EmptyText();
            @Override
            public String message() {
                return "Comment text cannot be empty";
            }

            @Override
            public String code() {
                return "COMMENT_TEXT_EMPTY";
            }
        }

        record TextTooLong(int length, int maxLength) implements CommentValidationError {
            @Override
            public String message() {
                return "Comment text exceeds " + maxLength + " characters (was " + length + ")";
            }

            @Override
            public String code() {
                return "COMMENT_TEXT_TOO_LONG";
            }
        }
    }
}
