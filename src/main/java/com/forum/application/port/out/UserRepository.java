package com.forum.application.port.out;

import com.forum.domain.model.User;
import com.forum.domain.model.UserId;

import java.time.Instant;
import java.util.Optional;

public interface UserRepository {
    void upsert(User user);
    Optional<User> findById(UserId id);

    Optional<Instant> findReadSinceWatermark(UserId id);

    /**
     * Moves the user's read-since watermark up to {@code at}. Single-row update; never moves it back.
     */
    void advanceReadSinceWatermark(UserId id, Instant at);
}
