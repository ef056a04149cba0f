package com.pawpal.core.model;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Governs whether completing a task spawns a successor, and how far out it is due.
 */
public enum Recurrence {
    NONE(0),
    DAILY(1),
    WEEKLY(7);

    private final int intervalDays;

    Recurrence(int intervalDays) {
        this.intervalDays = intervalDays;
    }

    public int intervalDays() {
        return intervalDays;
    }

    public boolean recurs() {
        return intervalDays > 0;
    }

    /**
     * @return the successor's due date, or empty for {@link #NONE}
     */
    public Optional<LocalDate> nextDueDate(LocalDate dueDate) {
        return recurs() ? Optional.of(dueDate.plusDays(intervalDays)) : Optional.empty();
    }

    /**
     * Parses the frequency words used by input documents: "once"/"none", "daily", "weekly".
     */
    public static Optional<Recurrence> parse(String value) {
        if (value == null) return Optional.empty();
        return switch (value.trim().toLowerCase()) {
            case "once", "none" -> Optional.of(NONE);
            case "daily" -> Optional.of(DAILY);
            case "weekly" -> Optional.of(WEEKLY);
            default -> Optional.empty();
        };
    }
}
