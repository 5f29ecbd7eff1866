package com.forum.application.service;

import com.forum.application.port.out.CategoryRepository;
import com.forum.application.port.out.UserRepository;
import com.forum.domain.filter.AppliedFilters;
import com.forum.domain.filter.CategoryFilter;
import com.forum.domain.filter.FilterOutcome;
import com.forum.domain.filter.FilterParams;
import com.forum.domain.filter.FilterResult;
import com.forum.domain.filter.RelationFilter;
import com.forum.domain.model.DiscussionQuery;
import com.forum.domain.model.ReadStatus;
import com.forum.domain.model.User;
import com.forum.domain.model.UserId;
import com.forum.domain.model.Viewer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Narrows a base query with the optional listing filters, in this fixed order:
 * category, relation to the viewer, authored-by-user, read status.
 *
 * <p>Unrecognized or unusable parameter values are ignored and reported as not applied. Relation and
 * read status need an authenticated viewer and are skipped for anonymous ones. Read status runs last
 * and is computed over the query as narrowed by the other three.
 */
@Component
public class FilterPipeline {

    private static final Logger log = LoggerFactory.getLogger(FilterPipeline.class);

    private final CategoryRepository categoryRepository;
    private final UserRepository userRepository;
    private final ReadStatusTracker readStatusTracker;

    public FilterPipeline(
            CategoryRepository categoryRepository,
            UserRepository userRepository,
            ReadStatusTracker readStatusTracker) {
        this.categoryRepository = categoryRepository;
        this.userRepository = userRepository;
        this.readStatusTracker = readStatusTracker;
    }

    public FilterResult apply(DiscussionQuery base, Viewer viewer, FilterParams params) {
        DiscussionQuery query = base;
        AppliedFilters applied = AppliedFilters.none();

        Optional<CategoryFilter> category = resolveCategory(params.category());
        if (category.isPresent()) {
            query = narrowByCategory(query, category.get());
            applied = applied.withCategory(FilterOutcome.applied(category.get()));
        }

        if (viewer.isAuthenticated()) {
            Optional<RelationFilter> relation = RelationFilter.fromParam(params.me());
            if (relation.isPresent()) {
                query = narrowByRelation(query, relation.get(), viewer.userId());
                applied = applied.withRelation(FilterOutcome.applied(relation.get()));
            }
        }

        Optional<User> author = resolveAuthor(params.user());
        if (author.isPresent()) {
            query = query.withCommentBy(author.get().id());
            applied = applied.withAuthoredBy(FilterOutcome.applied(author.get()));
        }

        // Must stay last: read status is computed over everything the filters above left
        if (viewer.isAuthenticated()) {
            Optional<ReadStatus> readStatus = ReadStatus.fromParam(params.read());
            if (readStatus.isPresent()) {
                query = narrowByReadStatus(query, readStatus.get(), viewer.userId());
                applied = applied.withReadStatus(FilterOutcome.applied(readStatus.get()));
            }
        }

        log.debug("Filters applied: category={}, relation={}, authoredBy={}, read={}",
            applied.category().isApplied(), applied.relation().isApplied(),
            applied.authoredBy().isApplied(), applied.readStatus().isApplied());

        return new FilterResult(query, applied);
    }

    private Optional<CategoryFilter> resolveCategory(String param) {
        if (param == null || param.isBlank()) {
            return Optional.empty();
        }
        if (CategoryFilter.NO_SCRIPTS_PARAM.equals(param)) {
            return Optional.of(CategoryFilter.NoScripts.INSTANCE);
        }
        Optional<CategoryFilter> keyed = categoryRepository.findByKey(param).map(CategoryFilter.Keyed::new);
        if (keyed.isEmpty()) {
            log.debug("Ignoring unknown category filter: {}", param);
        }
        return keyed;
    }

    private DiscussionQuery narrowByCategory(DiscussionQuery query, CategoryFilter category) {
        if (category instanceof CategoryFilter.Keyed keyed) {
            return query.withCategory(keyed.category().id());
        }
        return query.withNonScriptCategories();
    }

    private DiscussionQuery narrowByRelation(DiscussionQuery query, RelationFilter relation, UserId viewerId) {
        return switch (relation) {
            case STARTED -> query.withPoster(viewerId);
            case COMMENTED -> query.withCommentBy(viewerId);
            case SCRIPT_OWNER -> query.withScriptOwner(viewerId);
            case SUBSCRIBED -> query.withSubscriber(viewerId);
        };
    }

    private Optional<User> resolveAuthor(String param) {
        if (param == null) {
            return Optional.empty();
        }
        var userIdResult = UserId.parse(param);
        if (userIdResult.isFailure()) {
            log.debug("Ignoring user filter: {}", userIdResult.errorOrNull().message());
            return Optional.empty();
        }
        return userRepository.findById(userIdResult.getOrThrow());
    }

    private DiscussionQuery narrowByReadStatus(DiscussionQuery query, ReadStatus status, UserId viewerId) {
        Set<UUID> readIds = readStatusTracker.readIds(query, viewerId);
        return status == ReadStatus.READ
            ? query.withIdIn(readIds)
            : query.withIdNotIn(readIds);
    }
}
