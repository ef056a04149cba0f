package com.pawpal.dispatch.cli;

import com.pawpal.core.events.EventJournal;
import com.pawpal.core.input.InvalidInputException;
import com.pawpal.core.input.OwnerDocumentMapper;
import com.pawpal.core.model.ConflictReport;
import com.pawpal.core.model.Owner;
import com.pawpal.core.model.Schedule;
import com.pawpal.core.scheduler.CareScheduler;
import com.pawpal.core.scheduler.ConflictDetector;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.concurrent.Callable;

/**
 * CLI command: pawpal plan &lt;owner.json&gt;
 * <p>
 * Loads the owner document, generates the budgeted plan for the given day and
 * prints it with its decision trace. Overlapping scheduled tasks are reported
 * as warnings; they do not fail the command. With {@code --verbose} the events
 * published while planning are listed as well.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Generate a care plan within the owner's time budget")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Owner JSON document")
    private Path file;

    @Option(names = {"--date", "-d"}, description = "Plan date, YYYY-MM-DD (default: today)")
    private LocalDate date;

    @Option(names = {"--quiet", "-q"}, description = "Omit the per-task decision trace")
    private boolean quiet;

    @Option(names = {"--verbose", "-v"}, description = "List the planning events recorded for this owner")
    private boolean verbose;

    private final OwnerDocumentMapper mapper;
    private final CareScheduler scheduler;
    private final ConflictDetector conflictDetector;
    private final EventJournal journal;

    public PlanCommand(OwnerDocumentMapper mapper, CareScheduler scheduler, ConflictDetector conflictDetector,
                       EventJournal journal) {
        this.mapper = mapper;
        this.scheduler = scheduler;
        this.conflictDetector = conflictDetector;
        this.journal = journal;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        LocalDate day = date != null ? date : LocalDate.now();

        Owner owner;
        try {
            owner = mapper.read(file, day);
        } catch (InvalidInputException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        ConsoleOutput.info("Owner: " + owner);

        Schedule schedule = scheduler.generatePlan(owner, day);
        System.out.println();
        System.out.print(schedule.displayPlan());

        if (!quiet && !schedule.rationale().isEmpty()) {
            System.out.println();
            ConsoleOutput.info("Decisions:");
            schedule.rationale().forEach(ConsoleOutput::rationale);
        }

        ConflictReport report = conflictDetector.report(owner);
        if (report.hasConflicts()) {
            System.out.println();
            ConsoleOutput.warning(report.count() + " scheduling conflict(s):");
            report.conflicts().forEach(c -> System.out.println("  " + c));
        }

        if (verbose) {
            System.out.println();
            ConsoleOutput.info("Events:");
            journal.eventsFor(owner.id())
                    .forEach(e -> System.out.println("  " + EventJournal.describe(e)));
        }
        return 0;
    }
}
