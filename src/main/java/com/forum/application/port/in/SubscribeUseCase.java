package com.forum.application.port.in;

import com.forum.domain.error.DiscussionError;
import com.forum.domain.model.Result;
import com.forum.domain.model.Viewer;

import java.util.UUID;

public interface SubscribeUseCase {
    Result<Void, DiscussionError> subscribe(Viewer viewer, UUID discussionId);
}
