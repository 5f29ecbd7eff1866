package com.forum.domain.model;

import java.util.Optional;

/**
 * Whoever is looking at the board for the current request. Anonymous viewers have no user id.
 * Passed explicitly through services instead of being read from request-scoped state.
 */
public record Viewer(UserId userId, boolean moderator) {

    private static final Viewer ANONYMOUS = new Viewer(null, false);

    public Viewer {
        if (userId == null && moderator) {
            throw new IllegalStateException("An anonymous viewer cannot be a moderator");
        }
    }

    public static Viewer anonymous() {
        return ANONYMOUS;
    }

    public static Viewer of(User user) {
        return new Viewer(user.id(), user.moderator());
    }

    public static Viewer member(UserId userId) {
        return new Viewer(userId, false);
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    public Optional<UserId> user() {
        return Optional.ofNullable(userId);
    }
}
