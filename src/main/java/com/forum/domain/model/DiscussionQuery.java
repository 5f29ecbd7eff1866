package com.forum.domain.model;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable conjunction of predicates over discussions. Every {@code with*} method returns a narrower copy;
 * the persistence adapter translates the whole value into one SQL query.
 *
 * @param categoryId         exact category, or null
 * @param nonScriptOnly      restrict to categories flagged as not tied to a script
 * @param posterId           discussions started by this user, or null
 * @param commentedBy        every listed user must have commented on the discussion
 * @param scriptOwnerId      discussions on scripts owned by this user, or null
 * @param subscriberId       discussions this user is subscribed to, or null
 * @param idIn               only these ids; null means no id restriction, empty means nothing matches
 * @param idNotIn            never these ids
 */
public record DiscussionQuery(
    ModerationScope moderation,
    ContentSubset subset,
    Long categoryId,
    boolean nonScriptOnly,
    UserId posterId,
    Set<UserId> commentedBy,
    UserId scriptOwnerId,
    UserId subscriberId,
    Set<UUID> idIn,
    Set<UUID> idNotIn
) {
    public DiscussionQuery {
        commentedBy = Set.copyOf(commentedBy);
        idIn = idIn == null ? null : Set.copyOf(idIn);
        idNotIn = Set.copyOf(idNotIn);
    }

    public static DiscussionQuery of(ModerationScope moderation, ContentSubset subset) {
        return new DiscussionQuery(moderation, subset, null, false, null, Set.of(), null, null, null, Set.of());
    }

    /**
     * Every discussion ever started, whatever its moderation state or partition.
     */
    public static DiscussionQuery unrestricted() {
        return of(ModerationScope.Unrestricted.INSTANCE, ContentSubset.ALL);
    }

    public DiscussionQuery withCategory(long id) {
        return new DiscussionQuery(moderation, subset, id, nonScriptOnly, posterId, commentedBy,
            scriptOwnerId, subscriberId, idIn, idNotIn);
    }

    public DiscussionQuery withNonScriptCategories() {
        return new DiscussionQuery(moderation, subset, categoryId, true, posterId, commentedBy,
            scriptOwnerId, subscriberId, idIn, idNotIn);
    }

    public DiscussionQuery withPoster(UserId poster) {
        return new DiscussionQuery(moderation, subset, categoryId, nonScriptOnly, poster, commentedBy,
            scriptOwnerId, subscriberId, idIn, idNotIn);
    }

    public DiscussionQuery withCommentBy(UserId commenter) {
        Set<UserId> commenters = new HashSet<>(commentedBy);
        commenters.add(commenter);
        return new DiscussionQuery(moderation, subset, categoryId, nonScriptOnly, posterId, commenters,
            scriptOwnerId, subscriberId, idIn, idNotIn);
    }

    public DiscussionQuery withScriptOwner(UserId owner) {
        return new DiscussionQuery(moderation, subset, categoryId, nonScriptOnly, posterId, commentedBy,
            owner, subscriberId, idIn, idNotIn);
    }

    public DiscussionQuery withSubscriber(UserId subscriber) {
        return new DiscussionQuery(moderation, subset, categoryId, nonScriptOnly, posterId, commentedBy,
            scriptOwnerId, subscriber, idIn, idNotIn);
    }

    /**
     * Keeps only the given ids. Applied twice, the result is the intersection.
     */
    public DiscussionQuery withIdIn(Collection<UUID> ids) {
        Set<UUID> allowed = new HashSet<>(ids);
        if (idIn != null) {
            allowed.retainAll(idIn);
        }
        return new DiscussionQuery(moderation, subset, categoryId, nonScriptOnly, posterId, commentedBy,
            scriptOwnerId, subscriberId, allowed, idNotIn);
    }

    public DiscussionQuery withIdNotIn(Collection<UUID> ids) {
        Set<UUID> excluded = new HashSet<>(idNotIn);
        excluded.addAll(ids);
        return new DiscussionQuery(moderation, subset, categoryId, nonScriptOnly, posterId, commentedBy,
            scriptOwnerId, subscriberId, idIn, excluded);
    }
}
