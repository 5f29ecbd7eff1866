package com.forum.domain.model;

import com.forum.domain.error.ValidationError.CommentValidationError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Comment")
class CommentTest {

    private static final UUID DISCUSSION_ID = UUID.randomUUID();
    private static final UserId POSTER = UserId.of(5);

    @Test
    @DisplayName("Should create a comment with trimmed text")
    void shouldCreateComment() {
        var result = Comment.create(UUID.randomUUID(), DISCUSSION_ID, POSTER, "  Works for me  ");

        assertTrue(result.isSuccess());
        assertEquals("Works for me", result.getOrThrow().text());
        assertEquals(DISCUSSION_ID, result.getOrThrow().discussionId());
        assertNotNull(result.getOrThrow().createdAt());
    }

    @Test
    @DisplayName("Should reject empty text")
    void shouldRejectEmptyText() {
        var result = Comment.create(UUID.randomUUID(), DISCUSSION_ID, POSTER, "");

        assertInstanceOf(CommentValidationError.EmptyText.class, result.errorOrNull());
    }

    @Test
    @DisplayName("Should reject null text")
    void shouldRejectNullText() {
        var result = Comment.create(UUID.randomUUID(), DISCUSSION_ID, POSTER, null);

        assertInstanceOf(CommentValidationError.EmptyText.class, result.errorOrNull());
    }

    @Test
    @DisplayName("Should reject text over the maximum length")
    void shouldRejectTooLongText() {
        var result = Comment.create(UUID.randomUUID(), DISCUSSION_ID, POSTER, "x".repeat(Comment.MAX_TEXT_LENGTH + 1));

        assertInstanceOf(CommentValidationError.TextTooLong.class, result.errorOrNull());
    }
}
