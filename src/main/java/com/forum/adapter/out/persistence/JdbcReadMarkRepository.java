package com.forum.adapter.out.persistence;

import com.forum.application.port.out.ReadMarkRepository;
import com.forum.domain.model.ReadMark;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;

@Repository
public class JdbcReadMarkRepository implements ReadMarkRepository {

    private static final String UPSERT_SQL = """
        INSERT INTO read_marks (user_id, discussion_id, read_at)
        VALUES (?, ?, ?)
        ON CONFLICT (user_id, discussion_id) DO UPDATE SET read_at = EXCLUDED.read_at
        """;

    private static final int BATCH_SIZE = 1000;

    private final JdbcTemplate jdbc;

    public JdbcReadMarkRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void upsert(ReadMark mark) {
        jdbc.update(UPSERT_SQL, mark.userId().value(), mark.discussionId(), Timestamp.from(mark.readAt()));
    }

    @Override
    @Transactional
    public void upsertAll(Collection<ReadMark> marks) {
        if (marks.isEmpty()) {
            return;
        }
        jdbc.batchUpdate(UPSERT_SQL, new ArrayList<>(marks), BATCH_SIZE, (ps, mark) -> {
            ps.setLong(1, mark.userId().value());
            ps.setObject(2, mark.discussionId());
            ps.setTimestamp(3, Timestamp.from(mark.readAt()));
        });
    }
}
