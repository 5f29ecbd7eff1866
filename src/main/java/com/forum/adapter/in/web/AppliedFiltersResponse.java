package com.forum.adapter.in.web;

import com.forum.domain.filter.AppliedFilters;
import com.forum.domain.filter.CategoryFilter;
import com.forum.domain.filter.RelationFilter;
import com.forum.domain.model.ReadStatus;

/**
 * The filter values that took effect, in request-parameter form; null for each filter that did not.
 */
public record AppliedFiltersResponse(
    String category,
    String me,
    String user,
    String read
) {
    public static AppliedFiltersResponse from(AppliedFilters filters) {
        return new AppliedFiltersResponse(
            filters.category().asOptional().map(CategoryFilter::param).orElse(null),
            filters.relation().asOptional().map(RelationFilter::param).orElse(null),
            filters.authoredBy().asOptional().map(user -> user.id().toString()).orElse(null),
            filters.readStatus().asOptional().map(ReadStatus::param).orElse(null)
        );
    }
}
