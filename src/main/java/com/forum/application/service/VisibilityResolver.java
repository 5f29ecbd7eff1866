package com.forum.application.service;

import com.forum.domain.model.ContentSubset;
import com.forum.domain.model.DiscussionQuery;
import com.forum.domain.model.ModerationScope;
import com.forum.domain.model.Viewer;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Builds the base query a discussion must satisfy before any filter runs.
 *
 * <p>Listings use the strict form: visible discussions only. Single-discussion pages use the permissive
 * form, which also reveals discussions under review to moderators and to their own posters. Removed
 * discussions never pass either form. Script discussions must additionally fall into the requested
 * content subset.
 */
@Component
public class VisibilityResolver {

    public DiscussionQuery resolve(Viewer viewer, ContentSubset subset, boolean permissive) {
        Objects.requireNonNull(viewer, "viewer");
        Objects.requireNonNull(subset, "subset");
        return DiscussionQuery.of(moderationScope(viewer, permissive), subset);
    }

    private ModerationScope moderationScope(Viewer viewer, boolean permissive) {
        if (!permissive || !viewer.isAuthenticated()) {
            return ModerationScope.VisibleOnly.INSTANCE;
        }
        if (viewer.moderator()) {
            return ModerationScope.VisibleOrUnderReview.INSTANCE;
        }
        return new ModerationScope.VisibleOrOwnUnderReview(viewer.userId());
    }
}
