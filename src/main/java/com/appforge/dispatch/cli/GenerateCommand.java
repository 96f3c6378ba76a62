package com.appforge.dispatch.cli;

import com.appforge.core.engine.GenerationService;
import com.appforge.core.events.EventBus;
import com.appforge.core.model.GenerationOutcome;
import com.appforge.core.model.PlanningConstraints;
import com.appforge.core.planning.PlanningException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: appforge generate "&lt;requirement&gt;"
 * <p>
 * Plans the requirement into a task graph, executes it with live progress output and
 * prints the final task table. Ctrl-C cancels the run; the last checkpoint can be
 * resumed later with {@code appforge resume}.
 */
@Command(name = "generate", mixinStandardHelpOptions = true, description = "Generate an application from a requirement")
@Component
public class GenerateCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language description of the application")
    private String requirement;

    @Option(names = {"--module", "-m"},
            description = "Module to build (frontend, backend, database, auth); repeatable. Default: detected")
    private Set<String> modules = new LinkedHashSet<>();

    @Option(names = {"--framework", "-f"},
            description = "Framework override as kind=framework, e.g. frontend=vue; repeatable")
    private Map<String, String> frameworks = new LinkedHashMap<>();

    @Option(names = "--no-deployment", description = "Skip the deployment task")
    private boolean noDeployment;

    @Option(names = "--app-name", description = "Application name (default: derived from the requirement)")
    private String appName;

    @Option(names = "--timeout-minutes", description = "Stop waiting after this many minutes (default: ${DEFAULT-VALUE})",
            defaultValue = "30")
    private long timeoutMinutes;

    @Option(names = "--files", description = "List generated file paths per task")
    private boolean showFiles;

    @Option(names = {"--quiet", "-q"}, description = "Do not print progress events")
    private boolean quiet;

    private final GenerationService generationService;
    private final EventBus eventBus;

    public GenerateCommand(GenerationService generationService, EventBus eventBus) {
        this.generationService = generationService;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Planning...");

        EventBus.Subscription subscription = quiet ? () -> { } : eventBus.subscribeAll(ConsoleOutput::event);
        String generationId;
        try {
            generationId = generationService.submit(requirement,
                    new PlanningConstraints(modules, frameworks, !noDeployment, appName));
        } catch (PlanningException e) {
            subscription.unsubscribe();
            ConsoleOutput.error("Planning failed: " + e.getMessage());
            return;
        }
        ConsoleOutput.info("Generation " + generationId + " started");

        Thread cancelOnExit = new Thread(() -> generationService.cancel(generationId), "appforge-cancel");
        Runtime.getRuntime().addShutdownHook(cancelOnExit);
        try {
            awaitOutcome(generationId);
        } finally {
            subscription.unsubscribe();
            removeHook(cancelOnExit);
        }

        generationService.status(generationId).ifPresentOrElse(
                status -> ConsoleOutput.status(status, showFiles),
                () -> ConsoleOutput.error("No status recorded for " + generationId));
    }

    private void awaitOutcome(String generationId) {
        try {
            GenerationOutcome outcome = generationService.await(generationId, Duration.ofMinutes(timeoutMinutes));
            ConsoleOutput.info("Finished with outcome " + outcome);
        } catch (TimeoutException e) {
            ConsoleOutput.error("Timed out after " + timeoutMinutes + " minute(s); cancelling " + generationId);
            generationService.cancel(generationId);
            waitForCancellation(generationId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            generationService.cancel(generationId);
            ConsoleOutput.info("Interrupted.");
        } catch (RuntimeException e) {
            ConsoleOutput.error("Generation aborted: " + rootCauseMessage(e));
        }
    }

    private void waitForCancellation(String generationId) {
        try {
            generationService.await(generationId, Duration.ofMinutes(1));
        } catch (TimeoutException | RuntimeException e) {
            ConsoleOutput.error("Generation did not stop cleanly: " + rootCauseMessage(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running
        }
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
