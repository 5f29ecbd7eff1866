package com.forum.application.port.in;

import com.forum.domain.error.DiscussionError;
import com.forum.domain.model.Comment;
import com.forum.domain.model.Result;
import com.forum.domain.model.Viewer;

import java.util.UUID;

public interface PostCommentUseCase {
    Result<Comment, DiscussionError> postComment(Viewer viewer, UUID discussionId, String text);
}
