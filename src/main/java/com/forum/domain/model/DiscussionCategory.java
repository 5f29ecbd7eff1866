package com.forum.domain.model;

/**
 * @param categoryKey stable key used by the category filter and in URLs
 * @param nonScript   true for categories whose discussions are not tied to a script
 */
public record DiscussionCategory(
    long id,
    String categoryKey,
    boolean nonScript
) {
    /**
     * Category assigned to every discussion started on a script.
     */
    public static final String SCRIPT_DISCUSSIONS_KEY = "script-discussions";
}
