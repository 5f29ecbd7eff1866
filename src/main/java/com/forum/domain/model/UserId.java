package com.forum.domain.model;

import com.forum.domain.error.ValidationError.UserIdError;

/**
 * Value Object for User identity.
 * Users are numbered by the identity provider; only strictly positive ids are valid.
 */
public record UserId(long value) {

    public UserId {
        // Compact constructor for internal use - assumes validated input
        if (value <= 0) {
            throw new IllegalStateException("UserId must be positive, was " + value + " - use parse() for validation");
        }
    }

    /**
     * Parses a string into a UserId, returning a Result for expected validation failures.
     */
    public static Result<UserId, UserIdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(UserIdError.Empty.INSTANCE);
        }
        long parsed;
        try {
            parsed = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return Result.failure(new UserIdError.InvalidFormat(value));
        }
        if (parsed <= 0) {
            return Result.failure(new UserIdError.NotPositive(parsed));
        }
        return Result.success(new UserId(parsed));
    }

    public static UserId of(long value) {
        return new UserId(value);
    }

    /**
     * Creates a UserId from a trusted source (database rows, internal messages).
     *
     * @throws IllegalStateException if the value is not positive (indicates data corruption)
     */
    public static UserId fromTrusted(long value) {
        if (value <= 0) {
            throw new IllegalStateException("Corrupted UserId in trusted source: " + value);
        }
        return new UserId(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
