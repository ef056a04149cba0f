package com.pawpal.core.scheduler;

import com.pawpal.core.events.EventBus;
import com.pawpal.core.events.PawPalEvent;
import com.pawpal.core.logging.MdcContext;
import com.pawpal.core.metrics.PawPalMetrics;
import com.pawpal.core.model.Owner;
import com.pawpal.core.model.Schedule;
import com.pawpal.core.model.Task;
import com.pawpal.core.model.TaskCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Orders, filters and selects care tasks under an owner's daily time budget.
 *
 * <p>Every query works on a snapshot of the task list it is given and never
 * mutates it. Plan generation is a greedy, priority-then-duration selection:
 * highest priority first, shortest first among equal priorities, each task
 * accepted while it still fits in the remaining budget. This is not an optimal
 * packing; a lower-priority task can be accepted after a higher-priority one
 * was rejected for being too long.
 */
@Service
public class CareScheduler {

    private static final Logger log = LoggerFactory.getLogger(CareScheduler.class);

    private final EventBus eventBus;
    private final PawPalMetrics metrics;

    public CareScheduler(EventBus eventBus, PawPalMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    // --- Ordering ---

    public List<Task> orderByTime(List<Task> tasks) {
        return TaskOrdering.sorted(tasks, TaskOrdering.BY_TIME);
    }

    public List<Task> orderByPriority(List<Task> tasks) {
        return TaskOrdering.sorted(tasks, TaskOrdering.BY_PRIORITY);
    }

    /** All of the owner's tasks in chronological order. */
    public List<Task> sortByTime(Owner owner) {
        return orderByTime(owner.allTasks());
    }

    /** The owner's incomplete tasks in selection order. */
    public List<Task> prioritize(Owner owner) {
        return orderByPriority(owner.incompleteTasks());
    }

    // --- Filtering ---

    public List<Task> filterByStatus(List<Task> tasks, boolean completed) {
        return tasks.stream().filter(t -> t.isCompleted() == completed).toList();
    }

    public List<Task> filterBySubject(List<Task> tasks, String subjectId) {
        return tasks.stream().filter(t -> t.subjectId().map(subjectId::equals).orElse(false)).toList();
    }

    public List<Task> filterByCategory(List<Task> tasks, TaskCategory category) {
        return tasks.stream().filter(t -> t.category() == category).toList();
    }

    /**
     * Tasks of the owner's pets whose display name matches, ignoring case.
     * Several pets may share a name; all of them are included.
     */
    public List<Task> filterBySubjectName(Owner owner, String petName) {
        var result = new ArrayList<Task>();
        for (var pet : owner.pets()) {
            if (pet.name().equalsIgnoreCase(petName)) {
                result.addAll(pet.tasks());
            }
        }
        return result;
    }

    // --- Planning ---

    /**
     * Builds the plan for {@code date} from the owner's incomplete tasks.
     *
     * @param owner aggregate supplying tasks and the time budget
     * @param date  day the plan is for
     * @return a fresh schedule whose total never exceeds the owner's budget
     */
    public Schedule generatePlan(Owner owner, LocalDate date) {
        Objects.requireNonNull(date, "date");
        long started = System.nanoTime();
        MdcContext.setOwner(owner.id());
        try {
            List<Task> candidates = orderByPriority(filterByStatus(owner.allTasks(), false));
            int budget = owner.availableMinutes();

            log.info("generatePlan: {} candidate tasks, budget={} min, date={}",
                    candidates.size(), budget, date);

            var accepted = new ArrayList<Task>();
            var rejected = new ArrayList<Task>();
            var rationale = new ArrayList<String>();
            int remaining = budget;

            for (Task task : candidates) {
                if (task.fits(remaining)) {
                    remaining -= task.durationMinutes();
                    accepted.add(task);
                    rationale.add(String.format("accepted %s: priority=%d, duration=%d, remaining=%d",
                            task.name(), task.priority(), task.durationMinutes(), remaining));
                    log.debug("  {} [{}] accepted, {} min left", task.id(), task.name(), remaining);
                } else {
                    rejected.add(task);
                    rationale.add(String.format(
                            "rejected %s: priority=%d, duration=%d exceeds remaining=%d",
                            task.name(), task.priority(), task.durationMinutes(), remaining));
                    log.debug("  {} [{}] rejected: needs {} min, only {} left",
                            task.id(), task.name(), task.durationMinutes(), remaining);
                }
            }

            var schedule = new Schedule(date, accepted, budget - remaining, budget, rejected, rationale);

            log.info("Plan for {}: {} accepted, {} rejected, {}/{} min used",
                    date, accepted.size(), rejected.size(), schedule.totalDurationMinutes(), budget);
            if (!rejected.isEmpty()) {
                log.info("Did not fit: {}", rejected.stream().map(Task::name).toList());
            }

            metrics.recordPlan(accepted.size(), rejected.size());
            metrics.recordPlanningDuration(System.nanoTime() - started);
            eventBus.publish(PawPalEvent.of("plan.generated", owner.id(), null, Map.of(
                    "date", date.toString(),
                    "accepted", accepted.size(),
                    "rejected", rejected.size(),
                    "totalMinutes", schedule.totalDurationMinutes())));
            return schedule;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Re-checks a schedule against the owner's current budget.
     */
    public boolean validateConstraints(Owner owner, Schedule schedule) {
        return schedule.totalDurationMinutes() <= owner.availableMinutes();
    }
}
