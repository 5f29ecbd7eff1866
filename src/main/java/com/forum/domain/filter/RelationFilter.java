package com.forum.domain.filter;

import java.util.Arrays;
import java.util.Optional;

/**
 * How a discussion must relate to the authenticated viewer.
 */
public enum RelationFilter {
    STARTED("started"),
    COMMENTED("comment"),
    SCRIPT_OWNER("script"),
    SUBSCRIBED("subscribed");

    private final String param;

    RelationFilter(String param) {
        this.param = param;
    }

    public String param() {
        return param;
    }

    public static Optional<RelationFilter> fromParam(String value) {
        return Arrays.stream(values())
            .filter(relation -> relation.param.equals(value))
            .findFirst();
    }
}
