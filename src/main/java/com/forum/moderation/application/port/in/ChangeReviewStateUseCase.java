package com.forum.moderation.application.port.in;

import com.forum.domain.error.DiscussionError;
import com.forum.domain.model.Discussion;
import com.forum.domain.model.Result;
import com.forum.domain.model.Viewer;

import java.util.UUID;

public interface ChangeReviewStateUseCase {

    /**
     * @param state {@code visible} or {@code under_review}
     */
    Result<Discussion, DiscussionError> changeReviewState(Viewer moderator, UUID discussionId, String state);
}
