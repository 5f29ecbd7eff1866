package com.forum.moderation.adapter.in.web;

import com.forum.application.port.out.UserRepository;
import com.forum.domain.error.DiscussionError;
import com.forum.domain.error.ValidationError.DiscussionValidationError;
import com.forum.domain.model.Discussion;
import com.forum.domain.model.DiscussionCategory;
import com.forum.domain.model.ModerationState;
import com.forum.domain.model.Result;
import com.forum.domain.model.User;
import com.forum.domain.model.UserId;
import com.forum.domain.model.Viewer;
import com.forum.infrastructure.exception.ModeratorRequiredException;
import com.forum.moderation.application.port.in.ChangeReviewStateUseCase;
import com.forum.moderation.application.port.in.RemoveDiscussionUseCase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(ModerationController.class)
class ModerationControllerTest {

    private static final UserId MODERATOR_ID = UserId.of(1);
    private static final Viewer MODERATOR = new Viewer(MODERATOR_ID, true);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RemoveDiscussionUseCase removeDiscussionUseCase;

    @MockBean
    private ChangeReviewStateUseCase changeReviewStateUseCase;

    // Required for Spring context - used by AuthFilter
    @MockBean
    private UserRepository userRepository;

    @BeforeEach
    void setUp() {
        when(userRepository.findById(MODERATOR_ID))
            .thenReturn(Optional.of(new User(MODERATOR_ID, true, null, Instant.now())));
    }

    @Test
    void shouldRemoveDiscussion() throws Exception {
        UUID id = UUID.randomUUID();
        when(removeDiscussionUseCase.removeDiscussion(MODERATOR, id)).thenReturn(Result.success(null));

        mockMvc.perform(delete("/api/v1/discussions/" + id)
                .header("X-User-Id", "1"))
            .andExpect(status().isNoContent());
    }

    @Test
    void shouldForbidNonModerators() throws Exception {
        UUID id = UUID.randomUUID();
        when(removeDiscussionUseCase.removeDiscussion(eq(Viewer.member(UserId.of(2))), eq(id)))
            .thenThrow(new ModeratorRequiredException(UserId.of(2)));

        mockMvc.perform(delete("/api/v1/discussions/" + id)
                .header("X-User-Id", "2"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("MODERATOR_REQUIRED"));
    }

    @Test
    void shouldChangeReviewState() throws Exception {
        UUID id = UUID.randomUUID();
        Instant now = Instant.now();
        Discussion underReview = new Discussion(id, UserId.of(9), null, new DiscussionCategory(4, "requests", true),
            ModerationState.UNDER_REVIEW, "Spam?", now, now);
        when(changeReviewStateUseCase.changeReviewState(MODERATOR, id, "under_review"))
            .thenReturn(Result.success(underReview));

        mockMvc.perform(put("/api/v1/moderation/discussions/" + id + "/review-state")
                .header("X-User-Id", "1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"state\":\"under_review\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.moderationState").value("under_review"));
    }

    @Test
    void shouldRejectInvalidReviewState() throws Exception {
        UUID id = UUID.randomUUID();
        when(changeReviewStateUseCase.changeReviewState(MODERATOR, id, "removed"))
            .thenReturn(Result.failure(new DiscussionError.ValidationFailed(
                new DiscussionValidationError.InvalidReviewState("removed"))));

        mockMvc.perform(put("/api/v1/moderation/discussions/" + id + "/review-state")
                .header("X-User-Id", "1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"state\":\"removed\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("DISCUSSION_REVIEW_STATE_INVALID"));
    }

    @Test
    void shouldRejectBlankReviewState() throws Exception {
        mockMvc.perform(put("/api/v1/moderation/discussions/" + UUID.randomUUID() + "/review-state")
                .header("X-User-Id", "1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"state\":\"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }
}
