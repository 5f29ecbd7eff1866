package com.forum.adapter.in.web;

import com.forum.application.port.in.ListDiscussionsUseCase;
import com.forum.application.port.in.ListDiscussionsUseCase.DiscussionListing;
import com.forum.application.port.in.ListDiscussionsUseCase.ListedDiscussion;
import com.forum.application.port.in.MarkAllReadUseCase;
import com.forum.application.port.in.MarkAllReadUseCase.MarkAllReadOutcome;
import com.forum.application.port.in.PostCommentUseCase;
import com.forum.application.port.in.StartDiscussionUseCase;
import com.forum.application.port.in.StartDiscussionUseCase.StartDiscussionCommand;
import com.forum.application.port.in.SubscribeUseCase;
import com.forum.application.port.in.UnsubscribeUseCase;
import com.forum.application.port.in.ViewDiscussionUseCase;
import com.forum.application.port.in.ViewDiscussionUseCase.DiscussionView;
import com.forum.domain.error.DiscussionError;
import com.forum.domain.filter.FilterParams;
import com.forum.domain.model.Comment;
import com.forum.domain.model.ContentSubset;
import com.forum.domain.model.Discussion;
import com.forum.domain.model.Page;
import com.forum.domain.model.Result;
import com.forum.domain.model.UserId;
import com.forum.domain.model.Viewer;
import com.forum.infrastructure.config.AppProperties;
import com.forum.infrastructure.config.ContentSubsetResolver;
import com.forum.infrastructure.context.RequestContext;
import com.forum.infrastructure.exception.AuthenticationRequiredException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Discussions", description = "Discussion listing, reading and posting")
public class DiscussionController {

    private final ListDiscussionsUseCase listDiscussionsUseCase;
    private final ViewDiscussionUseCase viewDiscussionUseCase;
    private final StartDiscussionUseCase startDiscussionUseCase;
    private final PostCommentUseCase postCommentUseCase;
    private final SubscribeUseCase subscribeUseCase;
    private final UnsubscribeUseCase unsubscribeUseCase;
    private final MarkAllReadUseCase markAllReadUseCase;
    private final ContentSubsetResolver contentSubsetResolver;
    private final AppProperties appProperties;

    public DiscussionController(
            ListDiscussionsUseCase listDiscussionsUseCase,
            ViewDiscussionUseCase viewDiscussionUseCase,
            StartDiscussionUseCase startDiscussionUseCase,
            PostCommentUseCase postCommentUseCase,
            SubscribeUseCase subscribeUseCase,
            UnsubscribeUseCase unsubscribeUseCase,
            MarkAllReadUseCase markAllReadUseCase,
            ContentSubsetResolver contentSubsetResolver,
            AppProperties appProperties) {
        this.listDiscussionsUseCase = listDiscussionsUseCase;
        this.viewDiscussionUseCase = viewDiscussionUseCase;
        this.startDiscussionUseCase = startDiscussionUseCase;
        this.postCommentUseCase = postCommentUseCase;
        this.subscribeUseCase = subscribeUseCase;
        this.unsubscribeUseCase = unsubscribeUseCase;
        this.markAllReadUseCase = markAllReadUseCase;
        this.contentSubsetResolver = contentSubsetResolver;
        this.appProperties = appProperties;
    }

    @GetMapping("/discussions")
    @Operation(summary = "List discussions",
        description = "Visible discussions, most recently active first, narrowed by the optional filters. "
            + "Unrecognized filter values are ignored; the response reports which filters took effect.")
    public ResponseEntity<DiscussionListResponse> listDiscussions(
            HttpServletRequest request,
            @Parameter(description = "Category key, or 'no-scripts' for categories not tied to a script")
            @RequestParam(required = false) String category,
            @Parameter(description = "Relation to the signed-in user: started, comment, script or subscribed")
            @RequestParam(required = false) String me,
            @Parameter(description = "Only discussions this user commented on", example = "1")
            @RequestParam(required = false) String user,
            @Parameter(description = "read or unread; signed-in users only")
            @RequestParam(required = false) String read,
            @Parameter(description = "Pagination cursor from previous response")
            @RequestParam(required = false) String cursor,
            @Parameter(description = "Number of discussions to return (max 100)")
            @RequestParam(required = false) Integer limit) {

        ContentSubset subset = contentSubsetResolver.resolve(request.getServerName());
        FilterParams params = new FilterParams(category, me, user, read);

        DiscussionListing listing = listDiscussionsUseCase.listDiscussions(
            RequestContext.getViewer(), subset, params, cursor, effectiveLimit(limit));

        return ResponseEntity.ok(DiscussionListResponse.from(listing));
    }

    @GetMapping("/discussions/{id}")
    @Operation(summary = "Show a discussion",
        description = "Marks the discussion as read for signed-in users. Moderators and the poster also see it while under review.")
    public ResponseEntity<?> viewDiscussion(HttpServletRequest request, @PathVariable UUID id) {
        ContentSubset subset = contentSubsetResolver.resolve(request.getServerName());
        Result<DiscussionView, DiscussionError> result =
            viewDiscussionUseCase.viewDiscussion(RequestContext.getViewer(), subset, id);

        return result.isSuccess()
            ? ResponseEntity.ok(DiscussionViewResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    @PostMapping("/discussions")
    @Operation(summary = "Start a discussion",
        description = "Creates a discussion with its first comment. Discussions about a script go to the script discussions category.")
    public ResponseEntity<?> startDiscussion(
            @Valid @RequestBody StartDiscussionRequest body) {

        UserId posterId = requireUser("start discussions");
        Result<Discussion, DiscussionError> result = startDiscussionUseCase.startDiscussion(posterId,
            new StartDiscussionCommand(body.title(), body.category(), body.scriptId(), body.text(), body.subscribe()));

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(DiscussionResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    @PostMapping("/discussions/{id}/comments")
    @Operation(summary = "Post a comment", description = "Adds a comment and makes the discussion unread for everyone who had read it")
    public ResponseEntity<?> postComment(
            @PathVariable UUID id,
            @Valid @RequestBody PostCommentRequest body) {

        Result<Comment, DiscussionError> result = postCommentUseCase.postComment(RequestContext.getViewer(), id, body.text());

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(CommentResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    @PutMapping("/discussions/{id}/subscription")
    @Operation(summary = "Subscribe to a discussion", description = "Idempotent")
    public ResponseEntity<?> subscribe(
            @PathVariable UUID id) {
        Result<Void, DiscussionError> result = subscribeUseCase.subscribe(RequestContext.getViewer(), id);
        return result.isSuccess()
            ? ResponseEntity.noContent().build()
            : toErrorResponse(result.errorOrNull());
    }

    @DeleteMapping("/discussions/{id}/subscription")
    @Operation(summary = "Unsubscribe from a discussion", description = "Idempotent")
    public ResponseEntity<?> unsubscribe(
            @PathVariable UUID id) {
        Result<Void, DiscussionError> result = unsubscribeUseCase.unsubscribe(RequestContext.getViewer(), id);
        return result.isSuccess()
            ? ResponseEntity.noContent().build()
            : toErrorResponse(result.errorOrNull());
    }

    @PostMapping("/discussions/mark-all-read")
    @Operation(summary = "Mark discussions as read",
        description = "With a category, relation or user filter, marks each matching discussion as read. "
            + "Without one, marks the whole board as read up to now.")
    public ResponseEntity<MarkAllReadResponse> markAllRead(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String me,
            @RequestParam(required = false) String user,
            @RequestParam(required = false) String read) {

        MarkAllReadOutcome outcome = markAllReadUseCase.markAllRead(
            RequestContext.getViewer(), new FilterParams(category, me, user, read));
        return ResponseEntity.ok(MarkAllReadResponse.from(outcome));
    }

    private int effectiveLimit(Integer limit) {
        AppProperties.Discussions config = appProperties.getDiscussions();
        if (limit == null) {
            return config.getDefaultPageSize();
        }
        return Math.max(1, Math.min(limit, config.getMaxPageSize()));
    }

    private UserId requireUser(String action) {
        Viewer viewer = RequestContext.getViewer();
        return viewer.user().orElseThrow(() -> new AuthenticationRequiredException(action));
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(DiscussionError error) {
        HttpStatus status = error instanceof DiscussionError.NotFound
            ? HttpStatus.NOT_FOUND
            : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status)
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    public record StartDiscussionRequest(String title, String category, Long scriptId, String text, boolean subscribe) {}

    public record PostCommentRequest(String text) {}

    public record DiscussionListResponse(
        List<DiscussionResponse> data,
        Pagination pagination,
        AppliedFiltersResponse filters
    ) {
        public static DiscussionListResponse from(DiscussionListing listing) {
            Page<ListedDiscussion> page = listing.page();
            return new DiscussionListResponse(
                page.data().stream()
                    .map(listed -> DiscussionResponse.from(listed.discussion(), listed.readStatus()))
                    .toList(),
                new Pagination(page.nextCursor(), page.hasMore()),
                AppliedFiltersResponse.from(listing.filters()));
        }

        public record Pagination(String nextCursor, boolean hasMore) {}
    }

    public record DiscussionViewResponse(DiscussionResponse discussion, boolean subscribed) {
        public static DiscussionViewResponse from(DiscussionView view) {
            return new DiscussionViewResponse(DiscussionResponse.from(view.discussion()), view.subscribed());
        }
    }

    public record CommentResponse(
        UUID id,
        UUID discussionId,
        String posterId,
        String text,
        Instant createdAt
    ) {
        public static CommentResponse from(Comment comment) {
            return new CommentResponse(
                comment.id(), comment.discussionId(), comment.posterId().toString(), comment.text(), comment.createdAt());
        }
    }

    /**
     * @param scope  {@code filtered} when per-discussion marks were written, {@code watermark} otherwise
     * @param marked number of discussions marked; 0 for the watermark scope
     */
    public record MarkAllReadResponse(String scope, int marked, Instant at, AppliedFiltersResponse filters) {
        public static MarkAllReadResponse from(MarkAllReadOutcome outcome) {
            return new MarkAllReadResponse(
                outcome.scope().name().toLowerCase(Locale.ROOT),
                outcome.marked(),
                outcome.at(),
                AppliedFiltersResponse.from(outcome.filters())
            );
        }
    }
}
