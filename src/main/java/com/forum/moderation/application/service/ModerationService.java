package com.forum.moderation.application.service;

import com.forum.application.port.out.DiscussionRepository;
import com.forum.application.port.out.IdGenerator;
import com.forum.application.port.out.OutboxRepository;
import com.forum.application.service.VisibilityResolver;
import com.forum.domain.error.DiscussionError;
import com.forum.domain.error.ValidationError.DiscussionValidationError;
import com.forum.domain.event.DiscussionRemoved;
import com.forum.domain.model.ContentSubset;
import com.forum.domain.model.Discussion;
import com.forum.domain.model.DiscussionQuery;
import com.forum.domain.model.ModerationState;
import com.forum.domain.model.Result;
import com.forum.domain.model.UserId;
import com.forum.domain.model.Viewer;
import com.forum.infrastructure.context.RequestContext;
import com.forum.infrastructure.exception.AuthenticationRequiredException;
import com.forum.infrastructure.exception.ModeratorRequiredException;
import com.forum.moderation.application.port.in.ChangeReviewStateUseCase;
import com.forum.moderation.application.port.in.RemoveDiscussionUseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Moderator actions on discussions. Moderators see every discussion that is visible or under review;
 * removed discussions are gone for them too.
 */
@Service
public class ModerationService implements RemoveDiscussionUseCase, ChangeReviewStateUseCase {

    private static final Logger log = LoggerFactory.getLogger(ModerationService.class);

    private final DiscussionRepository discussionRepository;
    private final OutboxRepository outboxRepository;
    private final VisibilityResolver visibilityResolver;
    private final IdGenerator idGenerator;

    public ModerationService(
            DiscussionRepository discussionRepository,
            OutboxRepository outboxRepository,
            VisibilityResolver visibilityResolver,
            IdGenerator idGenerator) {
        this.discussionRepository = discussionRepository;
        this.outboxRepository = outboxRepository;
        this.visibilityResolver = visibilityResolver;
        this.idGenerator = idGenerator;
    }

    @Override
    @Transactional
    public Result<Void, DiscussionError> removeDiscussion(Viewer moderator, UUID discussionId) {
        UserId moderatorId = requireModerator(moderator);

        if (findModeratable(moderator, discussionId).isEmpty()) {
            return Result.failure(new DiscussionError.NotFound(discussionId));
        }

        discussionRepository.updateModerationState(discussionId, ModerationState.REMOVED);

        DiscussionRemoved event = DiscussionRemoved.from(idGenerator.generate(), discussionId, moderatorId);
        outboxRepository.save(event, RequestContext.getRequestId());
        log.debug("DiscussionRemoved event queued in outbox: eventId={}", event.eventId());

        log.info("Discussion removed: discussionId={}, moderatorId={}", discussionId, moderatorId);
        return Result.success(null);
    }

    @Override
    @Transactional
    public Result<Discussion, DiscussionError> changeReviewState(Viewer moderator, UUID discussionId, String state) {
        UserId moderatorId = requireModerator(moderator);

        Optional<ModerationState> target = ModerationState.fromCode(state)
            .filter(s -> s != ModerationState.REMOVED);
        if (target.isEmpty()) {
            log.warn("Rejected review state from moderator={}: {}", moderatorId, state);
            return Result.failure(new DiscussionError.ValidationFailed(
                new DiscussionValidationError.InvalidReviewState(state)));
        }

        Optional<Discussion> found = findModeratable(moderator, discussionId);
        if (found.isEmpty()) {
            return Result.failure(new DiscussionError.NotFound(discussionId));
        }

        discussionRepository.updateModerationState(discussionId, target.get());
        log.info("Review state changed: discussionId={}, from={}, to={}, moderatorId={}",
            discussionId, found.get().moderationState().code(), target.get().code(), moderatorId);

        return Result.success(found.get().withModerationState(target.get()));
    }

    private UserId requireModerator(Viewer viewer) {
        UserId userId = viewer.user()
            .orElseThrow(() -> new AuthenticationRequiredException("moderate discussions"));
        if (!viewer.moderator()) {
            log.warn("Moderation attempt by non-moderator: userId={}", userId);
            throw new ModeratorRequiredException(userId);
        }
        return userId;
    }

    private Optional<Discussion> findModeratable(Viewer moderator, UUID discussionId) {
        DiscussionQuery query = visibilityResolver.resolve(moderator, ContentSubset.ALL, true)
            .withIdIn(Set.of(discussionId));
        return discussionRepository.findOne(query);
    }
}
