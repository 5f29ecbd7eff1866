package com.forum.adapter.out.persistence;

import com.forum.domain.model.ContentSubset;
import com.forum.domain.model.DiscussionQuery;
import com.forum.domain.model.ModerationScope;
import com.forum.domain.model.ModerationState;
import com.forum.domain.model.UserId;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Translates a {@link DiscussionQuery} into a SQL condition over {@code discussions d}, joined with
 * {@code discussion_categories c} and left-joined with {@code scripts s}.
 *
 * <p>Id sets are bound as one comma-separated parameter cast to {@code uuid[]}, so the statement has the
 * same number of placeholders whatever the size of the set.
 */
final class DiscussionSql {

    static final String FROM = """
        FROM discussions d
        JOIN discussion_categories c ON c.id = d.discussion_category_id
        LEFT JOIN scripts s ON s.id = d.script_id
        """;

    private final List<String> conditions = new ArrayList<>();
    private final List<Object> params = new ArrayList<>();

    private DiscussionSql() {}

    static DiscussionSql where(DiscussionQuery query) {
        DiscussionSql sql = new DiscussionSql();
        sql.moderation(query.moderation());
        sql.subset(query.subset());

        if (query.categoryId() != null) {
            sql.add("d.discussion_category_id = ?", query.categoryId());
        }
        if (query.nonScriptOnly()) {
            sql.add("c.non_script");
        }
        if (query.posterId() != null) {
            sql.add("d.poster_id = ?", query.posterId().value());
        }
        for (UserId commenter : query.commentedBy()) {
            sql.add("EXISTS (SELECT 1 FROM comments cm WHERE cm.discussion_id = d.id AND cm.poster_id = ?)",
                commenter.value());
        }
        if (query.scriptOwnerId() != null) {
            sql.add("s.owner_id = ?", query.scriptOwnerId().value());
        }
        if (query.subscriberId() != null) {
            sql.add("EXISTS (SELECT 1 FROM discussion_subscriptions ds WHERE ds.discussion_id = d.id AND ds.user_id = ?)",
                query.subscriberId().value());
        }
        if (query.idIn() != null) {
            if (query.idIn().isEmpty()) {
                sql.add("FALSE");
            } else {
                sql.add("d.id = ANY(string_to_array(?, ',')::uuid[])", joinIds(query.idIn()));
            }
        }
        if (!query.idNotIn().isEmpty()) {
            sql.add("NOT (d.id = ANY(string_to_array(?, ',')::uuid[]))", joinIds(query.idNotIn()));
        }
        return sql;
    }

    private void moderation(ModerationScope scope) {
        if (scope instanceof ModerationScope.VisibleOnly) {
            add("d.moderation_state = ?", ModerationState.VISIBLE.code());
        } else if (scope instanceof ModerationScope.VisibleOrUnderReview) {
            add("d.moderation_state IN (?, ?)", ModerationState.VISIBLE.code(), ModerationState.UNDER_REVIEW.code());
        } else if (scope instanceof ModerationScope.VisibleOrOwnUnderReview own) {
            add("(d.moderation_state = ? OR (d.moderation_state = ? AND d.poster_id = ?))",
                ModerationState.VISIBLE.code(), ModerationState.UNDER_REVIEW.code(), own.posterId().value());
        }
    }

    private void subset(ContentSubset subset) {
        switch (subset) {
            case SENSITIVE -> add("(s.id IS NULL OR s.sensitive)");
            case NON_SENSITIVE -> add("(s.id IS NULL OR NOT s.sensitive)");
            case ALL -> { }
        }
    }

    private void add(String condition, Object... values) {
        conditions.add(condition);
        params.addAll(List.of(values));
    }

    /**
     * Appends the keyset condition for rows strictly after the given position in
     * {@code (last_activity_at DESC, id DESC)} order.
     */
    DiscussionSql after(Timestamp lastActivityAt, UUID id) {
        add("(d.last_activity_at, d.id) < (?, ?)", lastActivityAt, id);
        return this;
    }

    String clause() {
        return conditions.isEmpty() ? "" : "WHERE " + String.join("\n  AND ", conditions) + "\n";
    }

    List<Object> params() {
        return params;
    }

    private static String joinIds(Collection<UUID> ids) {
        return ids.stream().map(UUID::toString).collect(Collectors.joining(","));
    }
}
