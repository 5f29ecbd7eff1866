package com.forum.application.port.out;

import com.forum.domain.model.Comment;

public interface CommentRepository {
    void save(Comment comment);
}
