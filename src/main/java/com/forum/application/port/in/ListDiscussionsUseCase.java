package com.forum.application.port.in;

import com.forum.domain.filter.AppliedFilters;
import com.forum.domain.filter.FilterParams;
import com.forum.domain.model.ContentSubset;
import com.forum.domain.model.Discussion;
import com.forum.domain.model.Page;
import com.forum.domain.model.ReadStatus;
import com.forum.domain.model.Viewer;

public interface ListDiscussionsUseCase {
    DiscussionListing listDiscussions(Viewer viewer, ContentSubset subset, FilterParams params, String cursor, int limit);

    /**
     * @param readStatus the viewer's read status, null for anonymous viewers
     */
    record ListedDiscussion(Discussion discussion, ReadStatus readStatus) {}

    record DiscussionListing(Page<ListedDiscussion> page, AppliedFilters filters) {}
}
