package com.forum.adapter.in.web;

import com.forum.application.port.in.ListDiscussionsUseCase;
import com.forum.application.port.in.ListDiscussionsUseCase.DiscussionListing;
import com.forum.application.port.in.ListDiscussionsUseCase.ListedDiscussion;
import com.forum.application.port.in.MarkAllReadUseCase;
import com.forum.application.port.in.MarkAllReadUseCase.MarkAllReadOutcome;
import com.forum.application.port.in.MarkAllReadUseCase.MarkScope;
import com.forum.application.port.in.PostCommentUseCase;
import com.forum.application.port.in.StartDiscussionUseCase;
import com.forum.application.port.in.StartDiscussionUseCase.StartDiscussionCommand;
import com.forum.application.port.in.SubscribeUseCase;
import com.forum.application.port.in.UnsubscribeUseCase;
import com.forum.application.port.in.ViewDiscussionUseCase;
import com.forum.application.port.in.ViewDiscussionUseCase.DiscussionView;
import com.forum.application.port.out.UserRepository;
import com.forum.domain.error.DiscussionError;
import com.forum.domain.error.ValidationError.DiscussionValidationError;
import com.forum.domain.filter.AppliedFilters;
import com.forum.domain.filter.CategoryFilter;
import com.forum.domain.filter.FilterOutcome;
import com.forum.domain.filter.FilterParams;
import com.forum.domain.model.Comment;
import com.forum.domain.model.ContentSubset;
import com.forum.domain.model.Discussion;
import com.forum.domain.model.DiscussionCategory;
import com.forum.domain.model.ModerationState;
import com.forum.domain.model.Page;
import com.forum.domain.model.ReadStatus;
import com.forum.domain.model.Result;
import com.forum.domain.model.UserId;
import com.forum.domain.model.Viewer;
import com.forum.infrastructure.config.AppProperties;
import com.forum.infrastructure.config.ContentSubsetResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(DiscussionController.class)
class DiscussionControllerTest {

    private static final String TEST_USER_ID = "42";
    private static final UserId USER = UserId.of(42);
    private static final DiscussionCategory DEVELOPMENT = new DiscussionCategory(3, "development", true);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ListDiscussionsUseCase listDiscussionsUseCase;

    @MockBean
    private ViewDiscussionUseCase viewDiscussionUseCase;

    @MockBean
    private StartDiscussionUseCase startDiscussionUseCase;

    @MockBean
    private PostCommentUseCase postCommentUseCase;

    @MockBean
    private SubscribeUseCase subscribeUseCase;

    @MockBean
    private UnsubscribeUseCase unsubscribeUseCase;

    @MockBean
    private MarkAllReadUseCase markAllReadUseCase;

    @MockBean
    private ContentSubsetResolver contentSubsetResolver;

    @MockBean
    private AppProperties appProperties;

    // Required for Spring context - used by AuthFilter
    @MockBean
    private UserRepository userRepository;

    @BeforeEach
    void setUp() {
        AppProperties.Discussions discussions = new AppProperties.Discussions();
        discussions.setDefaultPageSize(50);
        discussions.setMaxPageSize(100);
        when(appProperties.getDiscussions()).thenReturn(discussions);
        when(contentSubsetResolver.resolve(any())).thenReturn(ContentSubset.NON_SENSITIVE);
    }

    private static Discussion discussion() {
        Instant now = Instant.now();
        return new Discussion(UUID.randomUUID(), UserId.of(7), null, DEVELOPMENT, ModerationState.VISIBLE,
            "How do I?", now, now);
    }

    @Test
    void shouldListDiscussionsWithReadFlagsAndFilters() throws Exception {
        Discussion discussion = discussion();
        AppliedFilters applied = AppliedFilters.none()
            .withCategory(FilterOutcome.applied(new CategoryFilter.Keyed(DEVELOPMENT)));
        DiscussionListing listing = new DiscussionListing(
            new Page<>(List.of(new ListedDiscussion(discussion, ReadStatus.UNREAD)), "next-cursor", true), applied);

        when(listDiscussionsUseCase.listDiscussions(
                eq(Viewer.member(USER)), eq(ContentSubset.NON_SENSITIVE),
                eq(new FilterParams("development", null, null, null)), isNull(), eq(50)))
            .thenReturn(listing);

        mockMvc.perform(get("/api/v1/discussions")
                .header("X-User-Id", TEST_USER_ID)
                .param("category", "development"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].id").value(discussion.id().toString()))
            .andExpect(jsonPath("$.data[0].category").value("development"))
            .andExpect(jsonPath("$.data[0].read").value("unread"))
            .andExpect(jsonPath("$.pagination.nextCursor").value("next-cursor"))
            .andExpect(jsonPath("$.pagination.hasMore").value(true))
            .andExpect(jsonPath("$.filters.category").value("development"))
            .andExpect(jsonPath("$.filters.me").value(nullValue()));
    }

    @Test
    void shouldListAnonymouslyWithoutReadFlags() throws Exception {
        DiscussionListing listing = new DiscussionListing(
            new Page<>(List.of(new ListedDiscussion(discussion(), null)), null, false), AppliedFilters.none());
        when(listDiscussionsUseCase.listDiscussions(eq(Viewer.anonymous()), any(), any(), isNull(), eq(50)))
            .thenReturn(listing);

        mockMvc.perform(get("/api/v1/discussions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].read").value(nullValue()))
            .andExpect(jsonPath("$.pagination.hasMore").value(false));
    }

    @Test
    void shouldClampLimitToMaxPageSize() throws Exception {
        when(listDiscussionsUseCase.listDiscussions(any(), any(), any(), eq("abc"), eq(100)))
            .thenReturn(new DiscussionListing(new Page<ListedDiscussion>(List.of(), null, false), AppliedFilters.none()));

        mockMvc.perform(get("/api/v1/discussions")
                .param("limit", "500")
                .param("cursor", "abc"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data").isArray());
    }

    @Test
    void shouldRejectInvalidUserIdHeader() throws Exception {
        mockMvc.perform(get("/api/v1/discussions")
                .header("X-User-Id", "not-a-number"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("USER_ID_INVALID_FORMAT"));
    }

    @Test
    void shouldShowDiscussion() throws Exception {
        Discussion discussion = discussion();
        when(viewDiscussionUseCase.viewDiscussion(Viewer.member(USER), ContentSubset.NON_SENSITIVE, discussion.id()))
            .thenReturn(Result.success(new DiscussionView(discussion, true)));

        mockMvc.perform(get("/api/v1/discussions/" + discussion.id())
                .header("X-User-Id", TEST_USER_ID))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.discussion.title").value("How do I?"))
            .andExpect(jsonPath("$.subscribed").value(true));
    }

    @Test
    void shouldReturnNotFoundForInvisibleDiscussion() throws Exception {
        UUID id = UUID.randomUUID();
        when(viewDiscussionUseCase.viewDiscussion(any(), any(), eq(id)))
            .thenReturn(Result.failure(new DiscussionError.NotFound(id)));

        mockMvc.perform(get("/api/v1/discussions/" + id))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("DISCUSSION_NOT_FOUND"));
    }

    @Test
    void shouldStartDiscussion() throws Exception {
        Discussion discussion = discussion();
        when(startDiscussionUseCase.startDiscussion(USER,
                new StartDiscussionCommand("How do I?", "development", null, "Details", true)))
            .thenReturn(Result.success(discussion));

        mockMvc.perform(post("/api/v1/discussions")
                .header("X-User-Id", TEST_USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"How do I?\",\"category\":\"development\",\"text\":\"Details\",\"subscribe\":true}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(discussion.id().toString()))
            .andExpect(jsonPath("$.moderationState").value("visible"));
    }

    @Test
    void shouldRejectAnonymousStart() throws Exception {
        mockMvc.perform(post("/api/v1/discussions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"T\",\"category\":\"development\",\"text\":\"x\"}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("AUTHENTICATION_REQUIRED"));

        verify(startDiscussionUseCase, never()).startDiscussion(any(), any());
    }

    @Test
    void shouldReportUnknownCategory() throws Exception {
        when(startDiscussionUseCase.startDiscussion(eq(USER), any()))
            .thenReturn(Result.failure(new DiscussionError.ValidationFailed(
                new DiscussionValidationError.UnknownCategory("bogus"))));

        mockMvc.perform(post("/api/v1/discussions")
                .header("X-User-Id", TEST_USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"T\",\"category\":\"bogus\",\"text\":\"x\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("DISCUSSION_CATEGORY_UNKNOWN"));
    }

    @Test
    void shouldPostComment() throws Exception {
        UUID discussionId = UUID.randomUUID();
        Comment comment = new Comment(UUID.randomUUID(), discussionId, USER, "Thanks", Instant.now());
        when(postCommentUseCase.postComment(Viewer.member(USER), discussionId, "Thanks"))
            .thenReturn(Result.success(comment));

        mockMvc.perform(post("/api/v1/discussions/" + discussionId + "/comments")
                .header("X-User-Id", TEST_USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"Thanks\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.discussionId").value(discussionId.toString()))
            .andExpect(jsonPath("$.posterId").value(TEST_USER_ID));
    }

    @Test
    void shouldSubscribeAndUnsubscribe() throws Exception {
        UUID discussionId = UUID.randomUUID();
        when(subscribeUseCase.subscribe(Viewer.member(USER), discussionId)).thenReturn(Result.success(null));
        when(unsubscribeUseCase.unsubscribe(Viewer.member(USER), discussionId)).thenReturn(Result.success(null));

        mockMvc.perform(put("/api/v1/discussions/" + discussionId + "/subscription")
                .header("X-User-Id", TEST_USER_ID))
            .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/discussions/" + discussionId + "/subscription")
                .header("X-User-Id", TEST_USER_ID))
            .andExpect(status().isNoContent());
    }

    @Test
    void shouldMarkFilteredDiscussionsRead() throws Exception {
        Instant at = Instant.parse("2024-03-01T12:00:00Z");
        AppliedFilters applied = AppliedFilters.none()
            .withCategory(FilterOutcome.applied(new CategoryFilter.Keyed(DEVELOPMENT)));
        when(markAllReadUseCase.markAllRead(Viewer.member(USER), new FilterParams("development", null, null, null)))
            .thenReturn(new MarkAllReadOutcome(MarkScope.FILTERED, 3, at, applied));

        mockMvc.perform(post("/api/v1/discussions/mark-all-read")
                .header("X-User-Id", TEST_USER_ID)
                .param("category", "development"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scope").value("filtered"))
            .andExpect(jsonPath("$.marked").value(3))
            .andExpect(jsonPath("$.filters.category").value("development"));
    }
}
