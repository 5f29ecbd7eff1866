package com.forum.application.port.in;

import com.forum.domain.model.DiscussionCategory;

import java.util.List;

public interface ListCategoriesUseCase {
    List<DiscussionCategory> listCategories();
}
