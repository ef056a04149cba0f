package com.pawpal.core.model;

/**
 * Two incomplete, scheduled tasks whose time ranges overlap.
 * <p>
 * {@code first} starts no later than {@code second}. End minutes are clamped to
 * {@link TimeOfDay#END_OF_DAY}; the {@code truncated} flags record when that happened.
 */
public record Conflict(
    Task first,
    int firstStart,
    int firstEnd,
    boolean firstTruncated,
    Task second,
    int secondStart,
    int secondEnd,
    boolean secondTruncated
) {

    public boolean truncated() {
        return firstTruncated || secondTruncated;
    }
}
