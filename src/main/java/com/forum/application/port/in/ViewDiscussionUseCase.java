package com.forum.application.port.in;

import com.forum.domain.error.DiscussionError;
import com.forum.domain.model.ContentSubset;
import com.forum.domain.model.Discussion;
import com.forum.domain.model.Result;
import com.forum.domain.model.Viewer;

import java.util.UUID;

public interface ViewDiscussionUseCase {
    Result<DiscussionView, DiscussionError> viewDiscussion(Viewer viewer, ContentSubset subset, UUID discussionId);

    record DiscussionView(Discussion discussion, boolean subscribed) {}
}
