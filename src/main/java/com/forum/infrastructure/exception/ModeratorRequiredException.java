package com.forum.infrastructure.exception;

import com.forum.domain.model.UserId;

public class ModeratorRequiredException extends BusinessException {

    public ModeratorRequiredException(UserId userId) {
        super("MODERATOR_REQUIRED", "User " + userId + " is not a moderator");
    }
}
