package com.forum.application.service;

import com.forum.application.port.in.ListCategoriesUseCase;
import com.forum.application.port.in.ListDiscussionsUseCase;
import com.forum.application.port.in.MarkAllReadUseCase;
import com.forum.application.port.in.StartDiscussionUseCase;
import com.forum.application.port.in.ViewDiscussionUseCase;
import com.forum.application.port.out.CategoryRepository;
import com.forum.application.port.out.CommentRepository;
import com.forum.application.port.out.DiscussionRepository;
import com.forum.application.port.out.IdGenerator;
import com.forum.application.port.out.MetricsPort;
import com.forum.application.port.out.OutboxRepository;
import com.forum.application.port.out.ScriptRepository;
import com.forum.application.port.out.SubscriptionRepository;
import com.forum.domain.error.DiscussionError;
import com.forum.domain.error.ValidationError.DiscussionValidationError;
import com.forum.domain.event.DiscussionStarted;
import com.forum.domain.filter.FilterParams;
import com.forum.domain.filter.FilterResult;
import com.forum.domain.model.ActivityCursor;
import com.forum.domain.model.Comment;
import com.forum.domain.model.ContentSubset;
import com.forum.domain.model.Discussion;
import com.forum.domain.model.DiscussionCategory;
import com.forum.domain.model.DiscussionQuery;
import com.forum.domain.model.Page;
import com.forum.domain.model.ReadStatus;
import com.forum.domain.model.Result;
import com.forum.domain.model.Script;
import com.forum.domain.model.UserId;
import com.forum.domain.model.Viewer;
import com.forum.infrastructure.context.RequestContext;
import com.forum.infrastructure.exception.AuthenticationRequiredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

@Service
public class DiscussionService implements ListDiscussionsUseCase, ViewDiscussionUseCase, StartDiscussionUseCase,
        MarkAllReadUseCase, ListCategoriesUseCase {

    private static final Logger log = LoggerFactory.getLogger(DiscussionService.class);

    private final DiscussionRepository discussionRepository;
    private final CommentRepository commentRepository;
    private final CategoryRepository categoryRepository;
    private final ScriptRepository scriptRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final OutboxRepository outboxRepository;
    private final VisibilityResolver visibilityResolver;
    private final FilterPipeline filterPipeline;
    private final ReadStatusTracker readStatusTracker;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;

    public DiscussionService(
            DiscussionRepository discussionRepository,
            CommentRepository commentRepository,
            CategoryRepository categoryRepository,
            ScriptRepository scriptRepository,
            SubscriptionRepository subscriptionRepository,
            OutboxRepository outboxRepository,
            VisibilityResolver visibilityResolver,
            FilterPipeline filterPipeline,
            ReadStatusTracker readStatusTracker,
            IdGenerator idGenerator,
            MetricsPort metrics) {
        this.discussionRepository = discussionRepository;
        this.commentRepository = commentRepository;
        this.categoryRepository = categoryRepository;
        this.scriptRepository = scriptRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.outboxRepository = outboxRepository;
        this.visibilityResolver = visibilityResolver;
        this.filterPipeline = filterPipeline;
        this.readStatusTracker = readStatusTracker;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
    }

    @Override
    @Transactional(readOnly = true)
    public DiscussionListing listDiscussions(
            Viewer viewer, ContentSubset subset, FilterParams params, String cursor, int limit) {
        log.debug("Listing discussions: viewer={}, subset={}, cursor={}, limit={}",
            viewer.userId(), subset, cursor != null ? "present" : "none", limit);

        DiscussionQuery base = visibilityResolver.resolve(viewer, subset, false);
        FilterResult filtered = filterPipeline.apply(base, viewer, params);

        ActivityCursor after = decodeCursor(cursor);
        List<Discussion> fetched = discussionRepository.find(filtered.query(), after, limit + 1);
        Page<Discussion> page = Page.fromLookahead(fetched, limit, d -> ActivityCursor.after(d).encode());
        Page<ListedDiscussion> listed = withReadStatus(page, viewer);

        metrics.incrementListings();
        log.debug("Returning {} discussions, hasMore={}", page.data().size(), page.hasMore());

        return new DiscussionListing(listed, filtered.applied());
    }

    private Page<ListedDiscussion> withReadStatus(Page<Discussion> page, Viewer viewer) {
        if (!viewer.isAuthenticated()) {
            return page.map(d -> new ListedDiscussion(d, null));
        }
        if (page.data().isEmpty()) {
            return page.map(d -> new ListedDiscussion(d, ReadStatus.UNREAD));
        }
        List<UUID> pageIds = page.data().stream().map(Discussion::id).toList();
        Set<UUID> read = readStatusTracker.readIds(DiscussionQuery.unrestricted().withIdIn(pageIds), viewer.userId());
        return page.map(d -> new ListedDiscussion(d, read.contains(d.id()) ? ReadStatus.READ : ReadStatus.UNREAD));
    }

    private ActivityCursor decodeCursor(String cursor) {
        Optional<ActivityCursor> decoded = ActivityCursor.decode(cursor);
        if (decoded.isEmpty() && cursor != null && !cursor.isBlank()) {
            log.warn("Invalid cursor: {}", cursor);
        }
        return decoded.orElse(null);
    }

    @Override
    @Transactional
    public Result<DiscussionView, DiscussionError> viewDiscussion(Viewer viewer, ContentSubset subset, UUID discussionId) {
        DiscussionQuery query = visibilityResolver.resolve(viewer, subset, true).withIdIn(Set.of(discussionId));
        Optional<Discussion> found = discussionRepository.findOne(query);
        if (found.isEmpty()) {
            log.debug("Discussion not visible: discussionId={}, viewer={}", discussionId, viewer.userId());
            return Result.failure(new DiscussionError.NotFound(discussionId));
        }

        Discussion discussion = found.get();
        boolean subscribed = false;
        if (viewer.isAuthenticated()) {
            readStatusTracker.recordView(viewer.userId(), discussionId, Instant.now());
            subscribed = subscriptionRepository.exists(viewer.userId(), discussionId);
        }
        return Result.success(new DiscussionView(discussion, subscribed));
    }

    @Override
    @Transactional
    public Result<Discussion, DiscussionError> startDiscussion(UserId posterId, StartDiscussionCommand command) {
        log.debug("Starting discussion for user={}, category={}, script={}",
            posterId, command.categoryKey(), command.scriptId());

        Script script = null;
        DiscussionCategory category;
        if (command.scriptId() != null) {
            Optional<Script> found = scriptRepository.findById(command.scriptId());
            if (found.isEmpty()) {
                return validationFailure(posterId, new DiscussionValidationError.UnknownScript(command.scriptId()));
            }
            script = found.get();
            category = categoryRepository.findByKey(DiscussionCategory.SCRIPT_DISCUSSIONS_KEY)
                .orElseThrow(() -> new IllegalStateException(
                    "Category " + DiscussionCategory.SCRIPT_DISCUSSIONS_KEY + " is not seeded"));
        } else if (command.categoryKey() == null || command.categoryKey().isBlank()) {
            return validationFailure(posterId, DiscussionValidationError.MissingCategory.INSTANCE);
        } else {
            Optional<DiscussionCategory> found = categoryRepository.findByKey(command.categoryKey());
            if (found.isEmpty()) {
                return validationFailure(posterId, new DiscussionValidationError.UnknownCategory(command.categoryKey()));
            }
            category = found.get();
        }

        UUID discussionId = idGenerator.generate();
        var discussionResult = Discussion.start(discussionId, posterId, command.title(), category, script);
        if (discussionResult.isFailure()) {
            return validationFailure(posterId, discussionResult.errorOrNull());
        }

        var commentResult = Comment.create(idGenerator.generate(), discussionId, posterId, command.text());
        if (commentResult.isFailure()) {
            log.warn("Discussion validation failed for user={}: {}", posterId, commentResult.errorOrNull().message());
            return Result.failure(new DiscussionError.ValidationFailed(commentResult.errorOrNull()));
        }

        Discussion discussion = discussionResult.getOrThrow();
        discussionRepository.save(discussion);
        commentRepository.save(commentResult.getOrThrow());
        if (command.subscribe()) {
            subscriptionRepository.subscribe(posterId, discussionId);
        }

        DiscussionStarted event = DiscussionStarted.from(idGenerator.generate(), discussion);
        outboxRepository.save(event, RequestContext.getRequestId());
        log.debug("DiscussionStarted event queued in outbox: eventId={}", event.eventId());

        metrics.incrementDiscussionsStarted();
        log.info("Discussion started: discussionId={}, userId={}, category={}",
            discussionId, posterId, category.categoryKey());

        return Result.success(discussion);
    }

    private Result<Discussion, DiscussionError> validationFailure(UserId posterId, DiscussionValidationError error) {
        log.warn("Discussion validation failed for user={}: {}", posterId, error.message());
        return Result.failure(new DiscussionError.ValidationFailed(error));
    }

    /**
     * Same filter parameters and semantics as the listing, but over every discussion ever started:
     * marking something read that the viewer cannot currently see is harmless.
     */
    @Override
    @Transactional
    public MarkAllReadOutcome markAllRead(Viewer viewer, FilterParams params) {
        UserId userId = viewer.user()
            .orElseThrow(() -> new AuthenticationRequiredException("mark discussions as read"));

        FilterResult filtered = filterPipeline.apply(DiscussionQuery.unrestricted(), viewer, params);
        return readStatusTracker.markAllRead(userId, filtered, Instant.now());
    }

    @Override
    @Transactional(readOnly = true)
    public List<DiscussionCategory> listCategories() {
        return categoryRepository.findAll();
    }
}
