package com.forum.application.port.out;

import com.forum.domain.model.ActivityCursor;
import com.forum.domain.model.Discussion;
import com.forum.domain.model.DiscussionActivity;
import com.forum.domain.model.DiscussionQuery;
import com.forum.domain.model.ModerationState;
import com.forum.domain.model.UserId;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DiscussionRepository {
    void save(Discussion discussion);

    /**
     * Discussions matching the query, most recently active first, starting strictly after the cursor.
     */
    List<Discussion> find(DiscussionQuery query, ActivityCursor after, int limit);

    Optional<Discussion> findOne(DiscussionQuery query);

    /**
     * Ids of every discussion matching the query, unordered and unpaginated.
     */
    List<UUID> findIds(DiscussionQuery query);

    /**
     * Last activity of every discussion matching the query, joined with the reader's read mark.
     */
    List<DiscussionActivity> findActivity(DiscussionQuery query, UserId reader);

    void updateModerationState(UUID id, ModerationState state);

    /**
     * Bumps last activity to {@code at} unless it is already later.
     */
    void touchLastActivity(UUID id, Instant at);
}
