package com.forum.application.port.in;

import com.forum.domain.filter.AppliedFilters;
import com.forum.domain.filter.FilterParams;
import com.forum.domain.model.Viewer;

import java.time.Instant;

public interface MarkAllReadUseCase {
    MarkAllReadOutcome markAllRead(Viewer viewer, FilterParams params);

    enum MarkScope {
        /** One read mark per discussion of the filtered set. */
        FILTERED,
        /** The viewer's read-since watermark moved; no per-discussion rows. */
        WATERMARK
    }

    /**
     * @param marked number of read marks written; always 0 for {@link MarkScope#WATERMARK}
     */
    record MarkAllReadOutcome(MarkScope scope, int marked, Instant at, AppliedFilters filters) {}
}
