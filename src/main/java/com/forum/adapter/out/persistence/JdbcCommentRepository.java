package com.forum.adapter.out.persistence;

import com.forum.application.port.out.CommentRepository;
import com.forum.domain.model.Comment;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;

@Repository
public class JdbcCommentRepository implements CommentRepository {

    private final JdbcTemplate jdbc;

    public JdbcCommentRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Comment comment) {
        jdbc.update("""
            INSERT INTO comments (id, discussion_id, poster_id, text, created_at)
            VALUES (?, ?, ?, ?, ?)
            """,
            comment.id(),
            comment.discussionId(),
            comment.posterId().value(),
            comment.text(),
            Timestamp.from(comment.createdAt())
        );
    }
}
