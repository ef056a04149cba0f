package com.pawpal.core.scheduler;

import com.pawpal.core.events.EventBus;
import com.pawpal.core.events.PawPalEvent;
import com.pawpal.core.logging.MdcContext;
import com.pawpal.core.metrics.PawPalMetrics;
import com.pawpal.core.model.Owner;
import com.pawpal.core.model.Task;
import com.pawpal.core.model.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The mutation channel into an owner's aggregate: marking tasks complete and
 * appending tasks to pets.
 * <p>
 * Completion reads and then extends a pet's task list, so mutations of the same
 * owner are serialized on a per-owner lock. Different owners proceed independently.
 */
@Service
public class TaskCompletionService {

    private static final Logger log = LoggerFactory.getLogger(TaskCompletionService.class);

    private final ConcurrentHashMap<String, ReentrantLock> ownerLocks = new ConcurrentHashMap<>();

    private final EventBus eventBus;
    private final PawPalMetrics metrics;

    public TaskCompletionService(EventBus eventBus, PawPalMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Marks the task complete and, for a recurring task, appends its successor
     * to the same pet.
     *
     * @return the appended successor, or empty for one-off or already-completed tasks
     * @throws TaskNotFoundException if the owner has no task with that id
     */
    public Optional<Task> completeTask(Owner owner, String taskId) {
        ReentrantLock lock = lockFor(owner);
        lock.lock();
        try {
            Task task = owner.findTask(taskId)
                    .orElseThrow(() -> new TaskNotFoundException(
                            "Task " + taskId + " not found for owner " + owner.id()));
            MdcContext.setTask(owner.id(), task.subjectId().orElse(null), task.id());

            if (task.isCompleted()) {
                log.debug("Task {} [{}] already completed, nothing to do", task.id(), task.name());
                return Optional.empty();
            }

            Optional<Task> successor = task.complete();
            log.info("Completed {} [{}] due {}", task.id(), task.name(), task.dueDate());
            metrics.recordCompletion(task.recurrence().name());
            eventBus.publish(PawPalEvent.of("task.completed", owner.id(), task.id(),
                    Map.of("name", task.name(), "recurrence", task.recurrence().name())));

            successor.ifPresent(next -> {
                String petId = task.subjectId().orElseThrow();
                owner.appendTask(petId, next);
                log.info("Next {} occurrence of '{}' due {} as {}",
                        task.recurrence(), next.name(), next.dueDate(), next.id());
                eventBus.publish(PawPalEvent.of("task.recurred", owner.id(), next.id(),
                        Map.of("previousTaskId", task.id(), "dueDate", next.dueDate().toString())));
            });
            return successor;
        } finally {
            MdcContext.clear();
            lock.unlock();
        }
    }

    /**
     * Appends a task to one of the owner's pets.
     *
     * @throws IllegalArgumentException if the owner has no pet with that id
     */
    public void addTask(Owner owner, String petId, Task task) {
        ReentrantLock lock = lockFor(owner);
        lock.lock();
        try {
            owner.appendTask(petId, task);
            log.debug("Added {} [{}] to pet {}", task.id(), task.name(), petId);
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(Owner owner) {
        return ownerLocks.computeIfAbsent(owner.id(), k -> new ReentrantLock());
    }
}
