package com.pawpal.dispatch.cli;

import com.pawpal.core.input.InvalidInputException;
import com.pawpal.core.input.OwnerDocumentMapper;
import com.pawpal.core.model.Owner;
import com.pawpal.core.model.Task;
import com.pawpal.core.model.TaskCategory;
import com.pawpal.core.scheduler.CareScheduler;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: pawpal tasks &lt;owner.json&gt;
 * <p>
 * Lists the owner's tasks, optionally filtered by pet, category and status,
 * sorted chronologically or in planning order.
 */
@Command(name = "tasks", mixinStandardHelpOptions = true, description = "List, filter and sort tasks")
@Component
public class TasksCommand implements Callable<Integer> {

    enum SortOrder { TIME, PRIORITY, NONE }

    enum StatusFilter { ALL, PENDING, DONE }

    @Parameters(index = "0", description = "Owner JSON document")
    private Path file;

    @Option(names = {"--sort", "-s"}, description = "Sort order: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "TIME")
    private SortOrder sort;

    @Option(names = {"--pet", "-p"}, description = "Only tasks of pets with this name")
    private String pet;

    @Option(names = {"--category", "-c"}, description = "Only tasks of this category (walk, feeding, ...)")
    private String category;

    @Option(names = "--status", description = "Status filter: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "ALL")
    private StatusFilter status;

    private final OwnerDocumentMapper mapper;
    private final CareScheduler scheduler;

    public TasksCommand(OwnerDocumentMapper mapper, CareScheduler scheduler) {
        this.mapper = mapper;
        this.scheduler = scheduler;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Owner owner;
        try {
            owner = mapper.read(file, LocalDate.now());
        } catch (InvalidInputException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        List<Task> tasks = pet != null ? scheduler.filterBySubjectName(owner, pet) : owner.allTasks();

        if (category != null) {
            Optional<TaskCategory> wanted = TaskCategory.fromLabel(category);
            if (wanted.isEmpty()) {
                ConsoleOutput.error("Unknown category: " + category);
                return 1;
            }
            tasks = scheduler.filterByCategory(tasks, wanted.get());
        }
        if (status != StatusFilter.ALL) {
            tasks = scheduler.filterByStatus(tasks, status == StatusFilter.DONE);
        }
        tasks = switch (sort) {
            case TIME -> scheduler.orderByTime(tasks);
            case PRIORITY -> scheduler.orderByPriority(tasks);
            case NONE -> tasks;
        };

        if (tasks.isEmpty()) {
            ConsoleOutput.info("No matching tasks.");
            return 0;
        }

        ConsoleOutput.info("Tasks (" + tasks.size() + " of " + owner.allTasks().size() + "):");
        System.out.println();
        for (Task task : tasks) {
            ConsoleOutput.taskRow(task, task.subjectId().map(owner::subjectName).orElse("-"));
        }
        return 0;
    }
}
