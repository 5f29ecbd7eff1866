package com.forum.adapter.out.persistence;

import com.forum.application.port.out.UserRepository;
import com.forum.domain.model.User;
import com.forum.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

@Repository
public class JdbcUserRepository implements UserRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<User> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp watermark = rs.getTimestamp("read_since_watermark");
        return new User(
            UserId.fromTrusted(rs.getLong("id")),
            rs.getBoolean("moderator"),
            watermark != null ? watermark.toInstant() : null,
            rs.getTimestamp("created_at").toInstant()
        );
    };

    public JdbcUserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Inserts the user if unknown. Existing rows keep their moderator flag and watermark.
     */
    @Override
    public void upsert(User user) {
        jdbc.update("""
            INSERT INTO users (id, moderator, read_since_watermark, created_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT (id) DO NOTHING
            """,
            user.id().value(),
            user.moderator(),
            user.watermark().map(Timestamp::from).orElse(null),
            Timestamp.from(user.createdAt())
        );
    }

    @Override
    public Optional<User> findById(UserId id) {
        return jdbc.query(
            "SELECT id, moderator, read_since_watermark, created_at FROM users WHERE id = ?",
            ROW_MAPPER,
            id.value()
        ).stream().findFirst();
    }

    @Override
    public Optional<Instant> findReadSinceWatermark(UserId id) {
        return jdbc.query(
            "SELECT read_since_watermark FROM users WHERE id = ?",
            (rs, rowNum) -> rs.getTimestamp("read_since_watermark"),
            id.value()
        ).stream().filter(Objects::nonNull).findFirst().map(Timestamp::toInstant);
    }

    @Override
    public void advanceReadSinceWatermark(UserId id, Instant at) {
        jdbc.update("""
            UPDATE users
            SET read_since_watermark = GREATEST(read_since_watermark, ?)
            WHERE id = ?
            """,
            Timestamp.from(at),
            id.value()
        );
    }
}
