package com.forum.domain.filter;

/**
 * Raw filter parameters exactly as the client sent them. Any of them may be null or nonsense;
 * the filter pipeline decides what counts.
 *
 * @param category a category key or {@code no-scripts}
 * @param me       relation to the viewer: {@code started}, {@code comment}, {@code script}, {@code subscribed}
 * @param user     id of a user whose comments the discussions must contain
 * @param read     {@code read} or {@code unread}
 */
public record FilterParams(
    String category,
    String me,
    String user,
    String read
) {
    public static FilterParams none() {
        return new FilterParams(null, null, null, null);
    }
}
