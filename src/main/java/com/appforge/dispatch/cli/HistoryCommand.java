package com.appforge.dispatch.cli;

import com.appforge.core.engine.GenerationService;
import com.appforge.core.model.GenerationStatus;
import com.appforge.core.model.TaskState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: appforge history
 * <p>
 * Lists checkpointed generations as a table: ID | Outcome | Tasks done | Requirement.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List past generations")
@Component
public class HistoryCommand implements Runnable {

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final GenerationService generationService;

    public HistoryCommand(GenerationService generationService) {
        this.generationService = generationService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<String> ids = generationService.history();
        if (ids.isEmpty()) {
            ConsoleOutput.info("No generations found.");
            return;
        }

        List<String> display = ids.size() > limit ? ids.subList(ids.size() - limit, ids.size()) : ids;

        ConsoleOutput.info("Generations (" + display.size() + " of " + ids.size() + "):");
        System.out.println();
        System.out.printf("  %-20s %-12s %-8s %s%n", "GENERATION ID", "OUTCOME", "DONE", "REQUIREMENT");
        System.out.println("  " + "-".repeat(72));

        for (String id : display) {
            var statusOpt = generationService.status(id);
            if (statusOpt.isPresent()) {
                GenerationStatus status = statusOpt.get();
                long done = status.tasks().stream().filter(t -> t.state() == TaskState.SUCCEEDED).count();
                String outcome = status.outcome() != null ? status.outcome().name() : "INCOMPLETE";
                System.out.printf("  %-20s %-12s %-8s %s%n", id, outcome,
                        done + "/" + status.tasks().size(), ConsoleOutput.truncate(status.requirement(), 30));
            } else {
                System.out.printf("  %-20s %-12s %-8s %s%n", id, "UNKNOWN", "-", "-");
            }
        }
    }
}
