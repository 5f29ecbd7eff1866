package com.forum.adapter.out.persistence;

import com.forum.application.port.out.CategoryRepository;
import com.forum.domain.model.DiscussionCategory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcCategoryRepository implements CategoryRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<DiscussionCategory> ROW_MAPPER = (rs, rowNum) -> new DiscussionCategory(
        rs.getLong("id"),
        rs.getString("category_key"),
        rs.getBoolean("non_script")
    );

    public JdbcCategoryRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<DiscussionCategory> findByKey(String categoryKey) {
        return jdbc.query(
            "SELECT id, category_key, non_script FROM discussion_categories WHERE category_key = ?",
            ROW_MAPPER,
            categoryKey
        ).stream().findFirst();
    }

    @Override
    public List<DiscussionCategory> findAll() {
        return jdbc.query(
            "SELECT id, category_key, non_script FROM discussion_categories ORDER BY id",
            ROW_MAPPER
        );
    }
}
