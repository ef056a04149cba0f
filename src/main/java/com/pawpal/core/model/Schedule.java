package com.pawpal.core.model;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of a planning request: the tasks accepted for {@code date} in the order
 * they were selected, plus the decision trace that produced them.
 * <p>
 * Tasks are references into the owner's aggregate, not copies. The schedule
 * itself is immutable; request a new one to change it.
 *
 * @param date                 day the plan is for
 * @param tasks                accepted tasks, in selection order
 * @param totalDurationMinutes sum of accepted durations, never above {@code budgetMinutes}
 * @param budgetMinutes        time budget the plan was generated against
 * @param rejected             tasks considered but not accepted, in consideration order
 * @param rationale            one entry per considered task
 */
public record Schedule(
    LocalDate date,
    List<Task> tasks,
    int totalDurationMinutes,
    int budgetMinutes,
    List<Task> rejected,
    List<String> rationale
) {

    public Schedule {
        tasks = List.copyOf(tasks);
        rejected = List.copyOf(rejected);
        rationale = List.copyOf(rationale);
        int sum = tasks.stream().mapToInt(Task::durationMinutes).sum();
        if (sum != totalDurationMinutes) {
            throw new IllegalArgumentException("Total duration " + totalDurationMinutes
                    + " does not match accepted tasks (" + sum + ")");
        }
        if (totalDurationMinutes > budgetMinutes) {
            throw new IllegalArgumentException("Total duration " + totalDurationMinutes
                    + " exceeds budget " + budgetMinutes);
        }
    }

    public static Schedule empty(LocalDate date, int budgetMinutes) {
        return new Schedule(date, List.of(), 0, budgetMinutes, List.of(), List.of());
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    public int remainingMinutes() {
        return budgetMinutes - totalDurationMinutes;
    }

    public boolean withinBudget() {
        return totalDurationMinutes <= budgetMinutes;
    }

    /**
     * One-paragraph explanation of the plan.
     */
    public String summary() {
        if (tasks.isEmpty() && rejected.isEmpty()) {
            return "No incomplete tasks to schedule.";
        }
        var sb = new StringBuilder();
        sb.append("Scheduled ").append(tasks.size()).append(" task(s) using ")
                .append(totalDurationMinutes).append('/').append(budgetMinutes).append(" minutes available.");
        if (!tasks.isEmpty()) {
            sb.append(" Tasks were prioritized by importance (higher priority first),"
                    + " then by duration (shorter tasks first for efficiency).");
        }
        if (!rejected.isEmpty()) {
            sb.append(' ').append(rejected.size()).append(" task(s) could not fit in the available time: ")
                    .append(rejected.stream().map(Task::name).collect(Collectors.joining(", ")))
                    .append('.');
        }
        return sb.toString();
    }

    /**
     * Numbered, human-readable rendering of the plan.
     */
    public String displayPlan() {
        if (tasks.isEmpty()) {
            return "Schedule for " + date + ": No tasks scheduled";
        }
        String rule = "-".repeat(50);
        var sb = new StringBuilder();
        sb.append("Schedule for ").append(date).append(":\n");
        sb.append("Total Duration: ").append(totalDurationMinutes).append(" minutes\n");
        sb.append(rule).append('\n');
        for (int i = 0; i < tasks.size(); i++) {
            sb.append(i + 1).append(". ").append(tasks.get(i)).append('\n');
        }
        sb.append(rule).append('\n');
        sb.append("Reasoning: ").append(summary()).append('\n');
        return sb.toString();
    }
}
