package com.forum.domain.filter;

import com.forum.domain.model.ReadStatus;
import com.forum.domain.model.User;

/**
 * Which filters of one pipeline run took effect. Consumed by mark-all-read to pick between bounded
 * per-discussion marks and the per-user watermark, and by clients to render active filters.
 */
public record AppliedFilters(
    FilterOutcome<CategoryFilter> category,
    FilterOutcome<RelationFilter> relation,
    FilterOutcome<User> authoredBy,
    FilterOutcome<ReadStatus> readStatus
) {
    public static AppliedFilters none() {
        return new AppliedFilters(
            FilterOutcome.notApplied(),
            FilterOutcome.notApplied(),
            FilterOutcome.notApplied(),
            FilterOutcome.notApplied()
        );
    }

    /**
     * True when category, relation or authored-by narrowed the set. Read status does not count:
     * it only partitions whatever the other filters left.
     */
    public boolean isNarrowed() {
        return category.isApplied() || relation.isApplied() || authoredBy.isApplied();
    }

    public AppliedFilters withCategory(FilterOutcome<CategoryFilter> outcome) {
        return new AppliedFilters(outcome, relation, authoredBy, readStatus);
    }

    public AppliedFilters withRelation(FilterOutcome<RelationFilter> outcome) {
        return new AppliedFilters(category, outcome, authoredBy, readStatus);
    }

    public AppliedFilters withAuthoredBy(FilterOutcome<User> outcome) {
        return new AppliedFilters(category, relation, outcome, readStatus);
    }

    public AppliedFilters withReadStatus(FilterOutcome<ReadStatus> outcome) {
        return new AppliedFilters(category, relation, authoredBy, outcome);
    }
}
