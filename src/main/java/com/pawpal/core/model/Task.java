package com.pawpal.core.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * A single schedulable care task belonging to one {@link Pet}.
 * <p>
 * Identity is the {@code id}, not the name: recurring tasks produce successors
 * with the same name and a fresh id. Ownership is recorded as the owning pet's id
 * rather than a live reference; {@link Pet#addTask(Task)} stamps it.
 * <p>
 * Everything except the completion flag and the owning-pet id is fixed at
 * construction. Completion is one-way, and the owning-pet id is set at most once.
 * A task loaded in its completed state is constructed completed rather than
 * completed afterwards, so loading never goes through {@link #complete()}.
 */
public final class Task {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;

    private final String id;
    private final String name;
    private final TaskCategory category;
    private final int durationMinutes;
    private final int priority;
    private final Recurrence recurrence;
    private final Integer scheduledTime;
    private final LocalDate dueDate;

    private String subjectId;
    private boolean completed;

    /**
     * @param id              stable unique identifier
     * @param name            display name (may repeat across occurrences)
     * @param category        kind of care
     * @param durationMinutes positive duration
     * @param priority        1..5, 5 is highest
     * @param recurrence      successor policy on completion
     * @param scheduledTime   minute of day 0..1439, or null when unscheduled
     * @param dueDate         calendar date the task is due
     * @param completed       whether the task is already done
     * @throws IllegalArgumentException if any value is outside its domain
     */
    public Task(String id, String name, TaskCategory category, int durationMinutes, int priority,
                Recurrence recurrence, Integer scheduledTime, LocalDate dueDate, boolean completed) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id must not be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name must not be blank");
        }
        if (durationMinutes <= 0) {
            throw new IllegalArgumentException("Duration must be positive, got " + durationMinutes + " for '" + name + "'");
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("Priority must be between 1 and 5, got " + priority + " for '" + name + "'");
        }
        if (scheduledTime != null && !TimeOfDay.isValid(scheduledTime)) {
            throw new IllegalArgumentException("Scheduled time out of range: " + scheduledTime + " for '" + name + "'");
        }
        this.id = id;
        this.name = name;
        this.category = Objects.requireNonNull(category, "category");
        this.durationMinutes = durationMinutes;
        this.priority = priority;
        this.recurrence = Objects.requireNonNull(recurrence, "recurrence");
        this.scheduledTime = scheduledTime;
        this.dueDate = Objects.requireNonNull(dueDate, "dueDate");
        this.completed = completed;
    }

    /**
     * Creates a pending task.
     */
    public Task(String id, String name, TaskCategory category, int durationMinutes, int priority,
                Recurrence recurrence, Integer scheduledTime, LocalDate dueDate) {
        this(id, name, category, durationMinutes, priority, recurrence, scheduledTime, dueDate, false);
    }

    /**
     * Creates a task with a generated id.
     */
    public static Task create(String name, TaskCategory category, int durationMinutes, int priority,
                              Recurrence recurrence, Integer scheduledTime, LocalDate dueDate) {
        return new Task(newId(), name, category, durationMinutes, priority, recurrence, scheduledTime, dueDate);
    }

    static String newId() {
        return "TASK-" + UUID.randomUUID();
    }

    public String id() { return id; }
    public String name() { return name; }
    public TaskCategory category() { return category; }
    public int durationMinutes() { return durationMinutes; }
    public int priority() { return priority; }
    public Recurrence recurrence() { return recurrence; }
    public LocalDate dueDate() { return dueDate; }
    public boolean isCompleted() { return completed; }

    public boolean isScheduled() {
        return scheduledTime != null;
    }

    public OptionalInt scheduledTime() {
        return scheduledTime != null ? OptionalInt.of(scheduledTime) : OptionalInt.empty();
    }

    /** Id of the owning pet, empty until the task is added to one. */
    public Optional<String> subjectId() {
        return Optional.ofNullable(subjectId);
    }

    public boolean fits(int remainingMinutes) {
        return durationMinutes <= remainingMinutes;
    }

    /**
     * Marks this task complete.
     * <p>
     * For a daily or weekly task that belongs to a pet, returns the next occurrence:
     * a new task (new id) due one or seven days after this one, with the same name,
     * category, duration, priority, recurrence and scheduled time. The successor is
     * not attached to any pet yet; the caller appends it to {@link #subjectId()}.
     * <p>
     * Completing an already-completed task does nothing and returns empty, so
     * repeated calls never produce duplicate chains.
     */
    public Optional<Task> complete() {
        if (completed) {
            return Optional.empty();
        }
        completed = true;
        if (subjectId == null) {
            return Optional.empty();
        }
        return recurrence.nextDueDate(dueDate)
                .map(next -> new Task(newId(), name, category, durationMinutes, priority,
                        recurrence, scheduledTime, next));
    }

    void assignTo(String subjectId) {
        if (this.subjectId != null && !this.subjectId.equals(subjectId)) {
            throw new IllegalStateException("Task " + id + " already belongs to " + this.subjectId);
        }
        this.subjectId = subjectId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Task other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        String status = completed ? "[x]" : "[ ]";
        return status + " " + name + " (" + category.label() + ") - " + durationMinutes
                + "min [Priority: " + priority + "]";
    }
}
