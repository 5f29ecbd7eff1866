package com.forum.application.port.in;

import com.forum.domain.error.DiscussionError;
import com.forum.domain.model.Discussion;
import com.forum.domain.model.Result;
import com.forum.domain.model.UserId;

public interface StartDiscussionUseCase {
    Result<Discussion, DiscussionError> startDiscussion(UserId posterId, StartDiscussionCommand command);

    /**
     * @param categoryKey ignored when {@code scriptId} is set
     * @param scriptId    script the discussion is about, or null
     * @param text        first comment
     */
    record StartDiscussionCommand(
        String title,
        String categoryKey,
        Long scriptId,
        String text,
        boolean subscribe
    ) {}
}
