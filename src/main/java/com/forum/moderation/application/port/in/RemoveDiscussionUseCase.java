package com.forum.moderation.application.port.in;

import com.forum.domain.error.DiscussionError;
import com.forum.domain.model.Result;
import com.forum.domain.model.Viewer;

import java.util.UUID;

public interface RemoveDiscussionUseCase {
    Result<Void, DiscussionError> removeDiscussion(Viewer moderator, UUID discussionId);
}
