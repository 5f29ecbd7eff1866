package com.forum.domain.model;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a keyset listing. {@code nextCursor} is null on the last page.
 */
public record Page<T>(
    List<T> data,
    String nextCursor,
    boolean hasMore
) {
    /**
     * Builds a page from a query that fetched up to {@code limit + 1} rows; the extra row only signals that
     * another page exists and is dropped.
     */
    public static <T> Page<T> fromLookahead(List<T> fetched, int limit, Function<T, String> cursorOf) {
        if (fetched.size() <= limit) {
            return new Page<>(List.copyOf(fetched), null, false);
        }
        List<T> data = List.copyOf(fetched.subList(0, limit));
        return new Page<>(data, cursorOf.apply(data.get(limit - 1)), true);
    }

    public <R> Page<R> map(Function<T, R> mapper) {
        return new Page<>(data.stream().map(mapper).toList(), nextCursor, hasMore);
    }
}
