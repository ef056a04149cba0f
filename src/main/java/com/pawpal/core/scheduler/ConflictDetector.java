package com.pawpal.core.scheduler;

import com.pawpal.core.events.EventBus;
import com.pawpal.core.events.PawPalEvent;
import com.pawpal.core.metrics.PawPalMetrics;
import com.pawpal.core.model.Conflict;
import com.pawpal.core.model.ConflictReport;
import com.pawpal.core.model.Owner;
import com.pawpal.core.model.Task;
import com.pawpal.core.model.TimeOfDay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Detects overlapping time ranges among incomplete, scheduled tasks.
 *
 * <p>A task occupies {@code [start, start + duration)}. Two tasks conflict iff
 * each starts strictly before the other ends, so back-to-back tasks do not
 * conflict. Pairs are checked across pets as well as within one: the owner is
 * the one bound by the clock.
 *
 * <p>Ranges do not roll into the next day. An end past 23:59 is clamped to 23:59
 * and the conflict is marked truncated.
 *
 * <p>The scan is a stable sort followed by an all-pairs check, O(n&sup2;) in the
 * number of scheduled tasks, which stays in the tens for a single household.
 */
@Service
public class ConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    static final String UNASSIGNED = "unassigned";

    private final EventBus eventBus;
    private final PawPalMetrics metrics;

    public ConflictDetector(EventBus eventBus, PawPalMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Structured overlap pairs, ordered by the first task's start then the second's.
     * Never throws for valid tasks; returns an empty list when nothing overlaps.
     */
    public List<Conflict> findConflicts(List<Task> tasks) {
        // a task listed twice must not conflict with itself
        List<Task> eligible = TaskOrdering.sorted(
                new ArrayList<>(new LinkedHashSet<>(tasks.stream()
                        .filter(t -> !t.isCompleted() && t.isScheduled())
                        .toList())),
                TaskOrdering.BY_TIME);

        var conflicts = new ArrayList<Conflict>();
        for (int i = 0; i < eligible.size(); i++) {
            Task a = eligible.get(i);
            int startA = a.scheduledTime().getAsInt();
            int rawEndA = startA + a.durationMinutes();
            int endA = Math.min(rawEndA, TimeOfDay.END_OF_DAY);

            for (int j = i + 1; j < eligible.size(); j++) {
                Task b = eligible.get(j);
                int startB = b.scheduledTime().getAsInt();
                int rawEndB = startB + b.durationMinutes();
                int endB = Math.min(rawEndB, TimeOfDay.END_OF_DAY);

                if (startA < endB && startB < endA) {
                    log.debug("Overlap: {} [{}-{}] and {} [{}-{}]",
                            a.name(), startA, endA, b.name(), startB, endB);
                    conflicts.add(new Conflict(a, startA, endA, rawEndA > TimeOfDay.END_OF_DAY,
                            b, startB, endB, rawEndB > TimeOfDay.END_OF_DAY));
                }
            }
        }
        return conflicts;
    }

    /**
     * Conflict descriptions for a bare task list, naming pets by id.
     */
    public List<String> detectConflicts(List<Task> tasks) {
        return describeAll(findConflicts(tasks), Function.identity());
    }

    /**
     * Conflict descriptions across all of the owner's pets, naming pets by display name.
     */
    public List<String> detectConflicts(Owner owner) {
        List<Conflict> conflicts = findConflicts(owner.allTasks());
        if (!conflicts.isEmpty()) {
            log.info("Owner {}: {} scheduling conflict(s)", owner.id(), conflicts.size());
        }
        metrics.recordConflicts(conflicts.size());
        eventBus.publish(PawPalEvent.of("conflicts.detected", owner.id(), null,
                Map.of("count", conflicts.size())));
        return describeAll(conflicts, owner::subjectName);
    }

    public ConflictReport report(Owner owner) {
        return new ConflictReport(detectConflicts(owner));
    }

    public ConflictReport report(List<Task> tasks) {
        return new ConflictReport(detectConflicts(tasks));
    }

    private List<String> describeAll(List<Conflict> conflicts, Function<String, String> subjectNames) {
        return conflicts.stream().map(c -> describe(c, subjectNames)).toList();
    }

    static String describe(Conflict c, Function<String, String> subjectNames) {
        String text = "CONFLICT: " + side(c.first(), c.firstStart(), c.firstEnd(), c.firstTruncated(), subjectNames)
                + " overlaps " + side(c.second(), c.secondStart(), c.secondEnd(), c.secondTruncated(), subjectNames);
        if (c.truncated()) {
            text += " [end truncated at " + TimeOfDay.format(TimeOfDay.END_OF_DAY) + "]";
        }
        return text;
    }

    private static String side(Task task, int start, int end, boolean truncated,
                               Function<String, String> subjectNames) {
        String subject = task.subjectId().map(subjectNames).orElse(UNASSIGNED);
        return "'" + task.name() + "' (" + subject + ") "
                + TimeOfDay.format(start) + "-" + TimeOfDay.format(end) + (truncated ? "*" : "");
    }
}
