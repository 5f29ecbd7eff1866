package com.forum.domain.model;

import com.forum.domain.error.ValidationError.DiscussionValidationError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Discussion")
class DiscussionTest {

    private static final UserId POSTER = UserId.of(1);
    private static final DiscussionCategory DEVELOPMENT = new DiscussionCategory(3, "development", true);
    private static final DiscussionCategory SCRIPT_DISCUSSIONS =
        new DiscussionCategory(1, DiscussionCategory.SCRIPT_DISCUSSIONS_KEY, false);
    private static final Script SCRIPT = new Script(10, UserId.of(2), "Dark mode", false);

    @Nested
    @DisplayName("start")
    class StartTests {

        @Test
        @DisplayName("Should start a visible discussion with last activity at creation")
        void shouldStartVisibleDiscussion() {
            UUID id = UUID.randomUUID();

            var result = Discussion.start(id, POSTER, "  How do I install?  ", DEVELOPMENT, null);

            assertTrue(result.isSuccess());
            Discussion discussion = result.getOrThrow();
            assertEquals(id, discussion.id());
            assertEquals("How do I install?", discussion.title());
            assertEquals(ModerationState.VISIBLE, discussion.moderationState());
            assertEquals(discussion.createdAt(), discussion.lastActivityAt());
            assertTrue(discussion.scriptRef().isEmpty());
        }

        @Test
        @DisplayName("Should start a script discussion")
        void shouldStartScriptDiscussion() {
            var result = Discussion.start(UUID.randomUUID(), POSTER, "Bug report", SCRIPT_DISCUSSIONS, SCRIPT);

            assertTrue(result.isSuccess());
            assertEquals(SCRIPT, result.getOrThrow().scriptRef().orElseThrow());
        }

        @Test
        @DisplayName("Should reject blank titles")
        void shouldRejectBlankTitle() {
            var result = Discussion.start(UUID.randomUUID(), POSTER, "   ", DEVELOPMENT, null);

            assertInstanceOf(DiscussionValidationError.EmptyTitle.class, result.errorOrNull());
        }

        @Test
        @DisplayName("Should reject titles over the maximum length")
        void shouldRejectLongTitle() {
            String title = "x".repeat(Discussion.MAX_TITLE_LENGTH + 1);

            var result = Discussion.start(UUID.randomUUID(), POSTER, title, DEVELOPMENT, null);

            assertInstanceOf(DiscussionValidationError.TitleTooLong.class, result.errorOrNull());
        }

        @Test
        @DisplayName("Should accept a title of exactly the maximum length")
        void shouldAcceptTitleAtLimit() {
            String title = "x".repeat(Discussion.MAX_TITLE_LENGTH);

            assertTrue(Discussion.start(UUID.randomUUID(), POSTER, title, DEVELOPMENT, null).isSuccess());
        }

        @Test
        @DisplayName("Should reject a missing category")
        void shouldRejectMissingCategory() {
            var result = Discussion.start(UUID.randomUUID(), POSTER, "Title", null, null);

            assertInstanceOf(DiscussionValidationError.MissingCategory.class, result.errorOrNull());
        }

        @Test
        @DisplayName("Should reject a script-only category without a script")
        void shouldRejectScriptCategoryWithoutScript() {
            var result = Discussion.start(UUID.randomUUID(), POSTER, "Title", SCRIPT_DISCUSSIONS, null);

            assertInstanceOf(DiscussionValidationError.CategoryRequiresScript.class, result.errorOrNull());
            assertEquals("DISCUSSION_CATEGORY_REQUIRES_SCRIPT", result.errorOrNull().code());
        }
    }

    @Test
    @DisplayName("withModerationState should keep everything else")
    void withModerationStateShouldKeepOtherFields() {
        Discussion discussion = Discussion.start(UUID.randomUUID(), POSTER, "Title", DEVELOPMENT, null).getOrThrow();

        Discussion underReview = discussion.withModerationState(ModerationState.UNDER_REVIEW);

        assertEquals(ModerationState.UNDER_REVIEW, underReview.moderationState());
        assertEquals(discussion.id(), underReview.id());
        assertEquals(discussion.lastActivityAt(), underReview.lastActivityAt());
    }
}
