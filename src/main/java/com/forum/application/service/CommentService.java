package com.forum.application.service;

import com.forum.application.port.in.PostCommentUseCase;
import com.forum.application.port.out.CommentRepository;
import com.forum.application.port.out.DiscussionRepository;
import com.forum.application.port.out.IdGenerator;
import com.forum.application.port.out.MetricsPort;
import com.forum.application.port.out.OutboxRepository;
import com.forum.domain.error.DiscussionError;
import com.forum.domain.event.CommentPosted;
import com.forum.domain.model.Comment;
import com.forum.domain.model.ContentSubset;
import com.forum.domain.model.DiscussionQuery;
import com.forum.domain.model.Result;
import com.forum.domain.model.UserId;
import com.forum.domain.model.Viewer;
import com.forum.infrastructure.context.RequestContext;
import com.forum.infrastructure.exception.AuthenticationRequiredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Set;
import java.util.UUID;

@Service
public class CommentService implements PostCommentUseCase {

    private static final Logger log = LoggerFactory.getLogger(CommentService.class);

    private final DiscussionRepository discussionRepository;
    private final CommentRepository commentRepository;
    private final OutboxRepository outboxRepository;
    private final VisibilityResolver visibilityResolver;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;

    public CommentService(
            DiscussionRepository discussionRepository,
            CommentRepository commentRepository,
            OutboxRepository outboxRepository,
            VisibilityResolver visibilityResolver,
            IdGenerator idGenerator,
            MetricsPort metrics) {
        this.discussionRepository = discussionRepository;
        this.commentRepository = commentRepository;
        this.outboxRepository = outboxRepository;
        this.visibilityResolver = visibilityResolver;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
    }

    /**
     * Only visible discussions take comments. The comment's timestamp becomes the discussion's last
     * activity, so every reader who had seen it sees it as unread again.
     */
    @Override
    @Transactional
    public Result<Comment, DiscussionError> postComment(Viewer viewer, UUID discussionId, String text) {
        UserId posterId = viewer.user()
            .orElseThrow(() -> new AuthenticationRequiredException("post comments"));
        log.debug("Posting comment: discussionId={}, user={}, textLength={}",
            discussionId, posterId, text != null ? text.length() : 0);

        DiscussionQuery visible = visibilityResolver.resolve(viewer, ContentSubset.ALL, false)
            .withIdIn(Set.of(discussionId));
        if (discussionRepository.findOne(visible).isEmpty()) {
            return Result.failure(new DiscussionError.NotFound(discussionId));
        }

        var commentResult = Comment.create(idGenerator.generate(), discussionId, posterId, text);
        if (commentResult.isFailure()) {
            log.warn("Comment validation failed for user={}: {}", posterId, commentResult.errorOrNull().message());
            return Result.failure(new DiscussionError.ValidationFailed(commentResult.errorOrNull()));
        }

        Comment comment = commentResult.getOrThrow();
        commentRepository.save(comment);
        discussionRepository.touchLastActivity(discussionId, comment.createdAt());

        CommentPosted event = CommentPosted.from(idGenerator.generate(), comment);
        outboxRepository.save(event, RequestContext.getRequestId());
        log.debug("CommentPosted event queued in outbox: eventId={}", event.eventId());

        metrics.incrementCommentsPosted();
        log.info("Comment posted: commentId={}, discussionId={}, userId={}", comment.id(), discussionId, posterId);

        return Result.success(comment);
    }
}
