package com.forum.application.port.in;

import com.forum.domain.error.DiscussionError;
import com.forum.domain.model.Result;
import com.forum.domain.model.Viewer;

import java.util.UUID;

public interface UnsubscribeUseCase {
    Result<Void, DiscussionError> unsubscribe(Viewer viewer, UUID discussionId);
}
