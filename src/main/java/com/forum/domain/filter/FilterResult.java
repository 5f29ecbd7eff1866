package com.forum.domain.filter;

import com.forum.domain.model.DiscussionQuery;

/**
 * The narrowed query together with the record of what narrowed it.
 */
public record FilterResult(DiscussionQuery query, AppliedFilters applied) {}
