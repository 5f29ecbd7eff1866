package com.forum.adapter.out.persistence;

import com.forum.application.port.out.SubscriptionRepository;
import com.forum.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;

@Repository
public class JdbcSubscriptionRepository implements SubscriptionRepository {

    private final JdbcTemplate jdbc;

    public JdbcSubscriptionRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean subscribe(UserId userId, UUID discussionId) {
        int inserted = jdbc.update("""
            INSERT INTO discussion_subscriptions (user_id, discussion_id, created_at)
            VALUES (?, ?, ?)
            ON CONFLICT (user_id, discussion_id) DO NOTHING
            """,
            userId.value(),
            discussionId,
            Timestamp.from(Instant.now())
        );
        return inserted > 0;
    }

    @Override
    public boolean unsubscribe(UserId userId, UUID discussionId) {
        int deleted = jdbc.update(
            "DELETE FROM discussion_subscriptions WHERE user_id = ? AND discussion_id = ?",
            userId.value(),
            discussionId
        );
        return deleted > 0;
    }

    @Override
    public boolean exists(UserId userId, UUID discussionId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM discussion_subscriptions WHERE user_id = ? AND discussion_id = ?",
            Integer.class,
            userId.value(),
            discussionId
        );
        return count != null && count > 0;
    }
}
