package com.forum.application.port.out;

import com.forum.domain.model.UserId;

import java.util.UUID;

public interface SubscriptionRepository {

    /**
     * @return true if a subscription was created, false if it already existed
     */
    boolean subscribe(UserId userId, UUID discussionId);

    /**
     * @return true if a subscription was removed, false if there was none
     */
    boolean unsubscribe(UserId userId, UUID discussionId);

    boolean exists(UserId userId, UUID discussionId);
}
