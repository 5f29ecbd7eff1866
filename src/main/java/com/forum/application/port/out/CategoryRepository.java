package com.forum.application.port.out;

import com.forum.domain.model.DiscussionCategory;

import java.util.List;
import java.util.Optional;

public interface CategoryRepository {
    Optional<DiscussionCategory> findByKey(String categoryKey);
    List<DiscussionCategory> findAll();
}
