package com.appforge.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for AppForge.
 * Routes to subcommands: generate, status, resume, history, health, providers.
 */
@Command(
        name = "appforge",
        mixinStandardHelpOptions = true,
        version = "AppForge 0.1.0",
        description = "Plans and generates full-stack applications with self-healing LLM execution",
        subcommands = {
                GenerateCommand.class,
                StatusCommand.class,
                ResumeCommand.class,
                HistoryCommand.class,
                HealthCommand.class,
                ProvidersCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AppforgeCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
