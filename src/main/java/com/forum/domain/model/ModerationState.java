package com.forum.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum ModerationState {
    VISIBLE("visible"),
    UNDER_REVIEW("under_review"),
    REMOVED("removed");

    private final String code;

    ModerationState(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<ModerationState> fromCode(String code) {
        return Arrays.stream(values())
            .filter(state -> state.code.equals(code))
            .findFirst();
    }

    /**
     * Reads a state stored by this service.
     *
     * @throws IllegalStateException for codes that were never written (indicates data corruption)
     */
    public static ModerationState fromTrusted(String code) {
        return fromCode(code)
            .orElseThrow(() -> new IllegalStateException("Corrupted moderation state in trusted source: " + code));
    }
}
