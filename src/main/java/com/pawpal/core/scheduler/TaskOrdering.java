package com.pawpal.core.scheduler;

import com.pawpal.core.model.Task;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Task orderings shared by planning and conflict detection.
 * Both sorts are stable: ties keep their input order.
 */
public final class TaskOrdering {

    /** Scheduled tasks by start minute, unscheduled tasks after all of them. */
    public static final Comparator<Task> BY_TIME = Comparator
            .comparing((Task t) -> !t.isScheduled())
            .thenComparingInt(t -> t.scheduledTime().orElse(0));

    /** Priority descending, then duration ascending. */
    public static final Comparator<Task> BY_PRIORITY = Comparator
            .comparingInt(Task::priority).reversed()
            .thenComparingInt(Task::durationMinutes);

    private TaskOrdering() {
        // utility class
    }

    public static List<Task> sorted(List<Task> tasks, Comparator<Task> order) {
        var copy = new ArrayList<>(tasks);
        // List.sort is a stable merge sort
        copy.sort(order);
        return copy;
    }
}
