package com.forum.application.service;

import com.forum.application.port.in.SubscribeUseCase;
import com.forum.application.port.in.UnsubscribeUseCase;
import com.forum.application.port.out.DiscussionRepository;
import com.forum.application.port.out.SubscriptionRepository;
import com.forum.domain.error.DiscussionError;
import com.forum.domain.model.ContentSubset;
import com.forum.domain.model.DiscussionQuery;
import com.forum.domain.model.Result;
import com.forum.domain.model.UserId;
import com.forum.domain.model.Viewer;
import com.forum.infrastructure.exception.AuthenticationRequiredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Set;
import java.util.UUID;

@Service
public class SubscriptionService implements SubscribeUseCase, UnsubscribeUseCase {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    private final DiscussionRepository discussionRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final VisibilityResolver visibilityResolver;

    public SubscriptionService(
            DiscussionRepository discussionRepository,
            SubscriptionRepository subscriptionRepository,
            VisibilityResolver visibilityResolver) {
        this.discussionRepository = discussionRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.visibilityResolver = visibilityResolver;
    }

    @Override
    @Transactional
    public Result<Void, DiscussionError> subscribe(Viewer viewer, UUID discussionId) {
        UserId userId = viewer.user()
            .orElseThrow(() -> new AuthenticationRequiredException("subscribe to discussions"));

        if (!isVisible(viewer, discussionId)) {
            return Result.failure(new DiscussionError.NotFound(discussionId));
        }

        boolean created = subscriptionRepository.subscribe(userId, discussionId);
        if (created) {
            log.info("Subscribed: userId={}, discussionId={}", userId, discussionId);
        } else {
            log.debug("Already subscribed: userId={}, discussionId={}", userId, discussionId);
        }
        return Result.success(null);
    }

    @Override
    @Transactional
    public Result<Void, DiscussionError> unsubscribe(Viewer viewer, UUID discussionId) {
        UserId userId = viewer.user()
            .orElseThrow(() -> new AuthenticationRequiredException("unsubscribe from discussions"));

        if (!isVisible(viewer, discussionId)) {
            return Result.failure(new DiscussionError.NotFound(discussionId));
        }

        boolean removed = subscriptionRepository.unsubscribe(userId, discussionId);
        if (removed) {
            log.info("Unsubscribed: userId={}, discussionId={}", userId, discussionId);
        } else {
            log.debug("No subscription to remove: userId={}, discussionId={}", userId, discussionId);
        }
        return Result.success(null);
    }

    private boolean isVisible(Viewer viewer, UUID discussionId) {
        DiscussionQuery query = visibilityResolver.resolve(viewer, ContentSubset.ALL, false)
            .withIdIn(Set.of(discussionId));
        return discussionRepository.findOne(query).isPresent();
    }
}
