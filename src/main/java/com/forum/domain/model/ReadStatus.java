package com.forum.domain.model;

import java.time.Instant;
import java.util.Optional;

/**
 * Read state of one discussion for one user.
 *
 * <p>A discussion is read when either the user's read mark for it or the user's global watermark is at or
 * after the discussion's last activity. Missing marks and watermarks count as minus infinity. The
 * watermark is a floor: it can make a discussion read, never unread, so an explicit mark does not expire
 * when a watermark is set.
 */
public enum ReadStatus {
    READ("read"),
    UNREAD("unread");

    private final String param;

    ReadStatus(String param) {
        this.param = param;
    }

    public String param() {
        return param;
    }

    public static ReadStatus of(Instant lastActivityAt, Instant markReadAt, Instant watermark) {
        if (covers(markReadAt, lastActivityAt) || covers(watermark, lastActivityAt)) {
            return READ;
        }
        return UNREAD;
    }

    public static Optional<ReadStatus> fromParam(String value) {
        if (READ.param.equals(value)) {
            return Optional.of(READ);
        }
        if (UNREAD.param.equals(value)) {
            return Optional.of(UNREAD);
        }
        return Optional.empty();
    }

    private static boolean covers(Instant seenUpTo, Instant lastActivityAt) {
        return seenUpTo != null && !seenUpTo.isBefore(lastActivityAt);
    }
}
