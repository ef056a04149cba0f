package com.pawpal.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of care a task represents.
 */
public enum TaskCategory {
    WALK("walk"),
    FEEDING("feeding"),
    MEDICATION("medication"),
    GROOMING("grooming"),
    ENRICHMENT("enrichment"),
    VET_VISIT("vet_visit");

    private final String label;

    TaskCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a category from its lowercase label or its enum name, ignoring case.
     */
    public static Optional<TaskCategory> fromLabel(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(c -> c.label.equalsIgnoreCase(normalized) || c.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
