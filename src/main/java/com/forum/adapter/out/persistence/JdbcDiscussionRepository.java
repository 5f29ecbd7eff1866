package com.forum.adapter.out.persistence;

import com.forum.application.port.out.DiscussionRepository;
import com.forum.domain.model.ActivityCursor;
import com.forum.domain.model.Discussion;
import com.forum.domain.model.DiscussionActivity;
import com.forum.domain.model.DiscussionCategory;
import com.forum.domain.model.DiscussionQuery;
import com.forum.domain.model.ModerationState;
import com.forum.domain.model.Script;
import com.forum.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class JdbcDiscussionRepository implements DiscussionRepository {

    private final JdbcTemplate jdbc;

    private static final String COLUMNS = """
        SELECT d.id, d.poster_id, d.moderation_state, d.title, d.last_activity_at, d.created_at,
               c.id AS category_id, c.category_key, c.non_script,
               s.id AS script_id, s.owner_id AS script_owner_id, s.name AS script_name, s.sensitive AS script_sensitive
        """;

    private static final RowMapper<Discussion> ROW_MAPPER = (rs, rowNum) -> {
        long scriptId = rs.getLong("script_id");
        Script script = rs.wasNull() ? null : new Script(
            scriptId,
            UserId.fromTrusted(rs.getLong("script_owner_id")),
            rs.getString("script_name"),
            rs.getBoolean("script_sensitive")
        );
        return new Discussion(
            UUID.fromString(rs.getString("id")),
            UserId.fromTrusted(rs.getLong("poster_id")),
            script,
            new DiscussionCategory(rs.getLong("category_id"), rs.getString("category_key"), rs.getBoolean("non_script")),
            ModerationState.fromTrusted(rs.getString("moderation_state")),
            rs.getString("title"),
            rs.getTimestamp("last_activity_at").toInstant(),
            rs.getTimestamp("created_at").toInstant()
        );
    };

    private static final RowMapper<DiscussionActivity> ACTIVITY_ROW_MAPPER = (rs, rowNum) -> {
        Timestamp readAt = rs.getTimestamp("read_at");
        return new DiscussionActivity(
            UUID.fromString(rs.getString("id")),
            rs.getTimestamp("last_activity_at").toInstant(),
            readAt != null ? readAt.toInstant() : null
        );
    };

    public JdbcDiscussionRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Discussion discussion) {
        jdbc.update("""
            INSERT INTO discussions (id, poster_id, script_id, discussion_category_id, moderation_state,
                                     title, last_activity_at, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """,
            discussion.id(),
            discussion.posterId().value(),
            discussion.scriptRef().map(Script::id).orElse(null),
            discussion.category().id(),
            discussion.moderationState().code(),
            discussion.title(),
            Timestamp.from(discussion.lastActivityAt()),
            Timestamp.from(discussion.createdAt())
        );
    }

    @Override
    public List<Discussion> find(DiscussionQuery query, ActivityCursor after, int limit) {
        DiscussionSql where = DiscussionSql.where(query);
        if (after != null) {
            where.after(Timestamp.from(after.lastActivityAt()), after.discussionId());
        }
        String sql = COLUMNS + DiscussionSql.FROM + where.clause() + """
            ORDER BY d.last_activity_at DESC, d.id DESC
            LIMIT ?
            """;
        List<Object> params = new ArrayList<>(where.params());
        params.add(limit);
        return jdbc.query(sql, ROW_MAPPER, params.toArray());
    }

    @Override
    public Optional<Discussion> findOne(DiscussionQuery query) {
        DiscussionSql where = DiscussionSql.where(query);
        String sql = COLUMNS + DiscussionSql.FROM + where.clause() + "LIMIT 1";
        return jdbc.query(sql, ROW_MAPPER, where.params().toArray()).stream().findFirst();
    }

    @Override
    public List<UUID> findIds(DiscussionQuery query) {
        DiscussionSql where = DiscussionSql.where(query);
        String sql = "SELECT d.id\n" + DiscussionSql.FROM + where.clause();
        return jdbc.query(sql, (rs, rowNum) -> UUID.fromString(rs.getString("id")), where.params().toArray());
    }

    @Override
    public List<DiscussionActivity> findActivity(DiscussionQuery query, UserId reader) {
        DiscussionSql where = DiscussionSql.where(query);
        String sql = """
            SELECT d.id, d.last_activity_at, r.read_at
            """ + DiscussionSql.FROM + """
            LEFT JOIN read_marks r ON r.discussion_id = d.id AND r.user_id = ?
            """ + where.clause();
        List<Object> params = new ArrayList<>();
        params.add(reader.value());
        params.addAll(where.params());
        return jdbc.query(sql, ACTIVITY_ROW_MAPPER, params.toArray());
    }

    @Override
    public void updateModerationState(UUID id, ModerationState state) {
        jdbc.update(
            "UPDATE discussions SET moderation_state = ? WHERE id = ?",
            state.code(),
            id
        );
    }

    @Override
    public void touchLastActivity(UUID id, Instant at) {
        jdbc.update(
            "UPDATE discussions SET last_activity_at = GREATEST(last_activity_at, ?) WHERE id = ?",
            Timestamp.from(at),
            id
        );
    }
}
