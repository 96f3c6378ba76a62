package com.appforge.dispatch.cli;

import com.appforge.core.engine.GenerationService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: appforge status &lt;generation-id&gt;
 * <p>
 * Reads the latest checkpoint of a generation and prints its task table.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show generation status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Generation ID")
    private String generationId;

    @Option(names = "--files", description = "List generated file paths per task")
    private boolean showFiles;

    private final GenerationService generationService;

    public StatusCommand(GenerationService generationService) {
        this.generationService = generationService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var statusOpt = generationService.status(generationId);
        if (statusOpt.isEmpty()) {
            ConsoleOutput.error("Generation not found: " + generationId);
            return;
        }
        ConsoleOutput.status(statusOpt.get(), showFiles);
    }
}
