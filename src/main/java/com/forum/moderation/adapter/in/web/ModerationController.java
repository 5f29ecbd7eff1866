package com.forum.moderation.adapter.in.web;

import com.forum.adapter.in.web.DiscussionResponse;
import com.forum.adapter.in.web.ErrorResponse;
import com.forum.domain.error.DiscussionError;
import com.forum.domain.model.Discussion;
import com.forum.domain.model.Result;
import com.forum.infrastructure.context.RequestContext;
import com.forum.moderation.application.port.in.ChangeReviewStateUseCase;
import com.forum.moderation.application.port.in.RemoveDiscussionUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Moderation", description = "Moderator-only discussion operations")
public class ModerationController {

    private final RemoveDiscussionUseCase removeDiscussionUseCase;
    private final ChangeReviewStateUseCase changeReviewStateUseCase;

    public ModerationController(
            RemoveDiscussionUseCase removeDiscussionUseCase,
            ChangeReviewStateUseCase changeReviewStateUseCase) {
        this.removeDiscussionUseCase = removeDiscussionUseCase;
        this.changeReviewStateUseCase = changeReviewStateUseCase;
    }

    @DeleteMapping("/discussions/{id}")
    @Operation(summary = "Remove a discussion", description = "Soft delete; the discussion disappears for everyone")
    public ResponseEntity<?> removeDiscussion(
            @PathVariable UUID id) {
        Result<Void, DiscussionError> result = removeDiscussionUseCase.removeDiscussion(RequestContext.getViewer(), id);
        return result.isSuccess()
            ? ResponseEntity.noContent().build()
            : toErrorResponse(result.errorOrNull());
    }

    @PutMapping("/moderation/discussions/{id}/review-state")
    @Operation(summary = "Change review state",
        description = "Puts a discussion under review (hidden from listings) or makes it visible again")
    public ResponseEntity<?> changeReviewState(
            @PathVariable UUID id,
            @Valid @RequestBody ReviewStateRequest body) {
        Result<Discussion, DiscussionError> result =
            changeReviewStateUseCase.changeReviewState(RequestContext.getViewer(), id, body.state());
        return result.isSuccess()
            ? ResponseEntity.ok(DiscussionResponse.from(result.getOrThrow()))
            : toErrorResponse(result.errorOrNull());
    }

    private ResponseEntity<ErrorResponse> toErrorResponse(DiscussionError error) {
        HttpStatus status = error instanceof DiscussionError.NotFound
            ? HttpStatus.NOT_FOUND
            : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status)
            .body(new ErrorResponse(error.code(), error.message(), RequestContext.getRequestId()));
    }

    public record ReviewStateRequest(@NotBlank String state) {}
}
