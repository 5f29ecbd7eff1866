package com.forum.domain.filter;

import java.util.Optional;

/**
 * Whether one filter of the pipeline actually narrowed the result, and with which value.
 * "Parameter absent" and "parameter present but unusable" are both {@link NotApplied}.
 */
public sealed interface FilterOutcome<T> {

    record Applied<T>(T value) implements FilterOutcome<T> {
        @Override
        public boolean isApplied() {
            return true;
        }

        @Override
        public Optional<T> asOptional() {
            return Optional.of(value);
        }
    }

    record NotApplied<T>() implements FilterOutcome<T> {
        @Override
        public boolean isApplied() {
            return false;
        }

        @Override
        public Optional<T> asOptional() {
            return Optional.empty();
        }
    }

    boolean isApplied();

    Optional<T> asOptional();

    static <T> FilterOutcome<T> applied(T value) {
        return new Applied<>(value);
    }

    static <T> FilterOutcome<T> notApplied() {
        return new NotApplied<>();
    }
}
