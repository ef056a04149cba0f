package com.pawpal.dispatch.cli;

import com.pawpal.core.input.InvalidInputException;
import com.pawpal.core.input.OwnerDocumentMapper;
import com.pawpal.core.model.ConflictReport;
import com.pawpal.core.model.Owner;
import com.pawpal.core.scheduler.ConflictDetector;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.concurrent.Callable;

/**
 * CLI command: pawpal conflicts &lt;owner.json&gt;
 */
@Command(name = "conflicts", mixinStandardHelpOptions = true, description = "Report overlapping scheduled tasks")
@Component
public class ConflictsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Owner JSON document")
    private Path file;

    private final OwnerDocumentMapper mapper;
    private final ConflictDetector conflictDetector;

    public ConflictsCommand(OwnerDocumentMapper mapper, ConflictDetector conflictDetector) {
        this.mapper = mapper;
        this.conflictDetector = conflictDetector;
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

        ConflictReport report = conflictDetector.report(owner);
        if (report.hasConflicts()) {
            ConsoleOutput.warning(report.render());
        } else {
            ConsoleOutput.success(report.render());
        }
        return 0;
    }
}
