package com.forum.adapter.out.persistence;

import com.forum.application.port.out.ScriptRepository;
import com.forum.domain.model.Script;
import com.forum.domain.model.UserId;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class JdbcScriptRepository implements ScriptRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Script> ROW_MAPPER = (rs, rowNum) -> new Script(
        rs.getLong("id"),
        UserId.fromTrusted(rs.getLong("owner_id")),
        rs.getString("name"),
        rs.getBoolean("sensitive")
    );

    public JdbcScriptRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<Script> findById(long id) {
        return jdbc.query(
            "SELECT id, owner_id, name, sensitive FROM scripts WHERE id = ?",
            ROW_MAPPER,
            id
        ).stream().findFirst();
    }
}
