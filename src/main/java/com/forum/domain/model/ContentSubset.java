package com.forum.domain.model;

import java.util.Arrays;

/**
 * Deployment-level partition of script discussions by the script's sensitivity flag.
 * Discussions without a script belong to every subset.
 */
public enum ContentSubset {
    SENSITIVE("sensitive"),
    NON_SENSITIVE("non-sensitive"),
    ALL("all");

    private final String configValue;

    ContentSubset(String configValue) {
        this.configValue = configValue;
    }

    public String configValue() {
        return configValue;
    }

    /**
     * Resolves a configured subset name.
     *
     * @throws IllegalStateException for unknown names; a misconfigured deployment, not a user error
     */
    public static ContentSubset fromConfig(String value) {
        return Arrays.stream(values())
            .filter(subset -> subset.configValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Unknown content subset " + value));
    }
}
