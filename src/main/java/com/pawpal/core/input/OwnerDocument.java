package com.pawpal.core.input;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON shape of an owner and their pets' tasks, as supplied by the caller.
 * <p>
 * Times and frequencies arrive as text ({@code "07:30"}, {@code "weekly"}) and are
 * converted by {@link OwnerDocumentMapper}; nothing past that boundary sees strings.
 */
public record OwnerDocument(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("available_minutes") Integer availableMinutes,
    @JsonProperty("pets") List<PetDocument> pets
) {

    public record PetDocument(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("species") String species,
        @JsonProperty("age") Integer age,
        @JsonProperty("special_needs") String specialNeeds,
        @JsonProperty("tasks") List<TaskDocument> tasks
    ) {}

    /**
     * @param scheduledTime "HH:MM", or null/blank for an unscheduled task
     * @param frequency     "once", "daily" or "weekly"; defaults to daily
     * @param dueDate       ISO date; defaults to the reference date
     */
    public record TaskDocument(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("category") String category,
        @JsonProperty("duration_minutes") Integer durationMinutes,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("frequency") String frequency,
        @JsonProperty("scheduled_time") String scheduledTime,
        @JsonProperty("due_date") String dueDate,
        @JsonProperty("completed") Boolean completed
    ) {}
}
