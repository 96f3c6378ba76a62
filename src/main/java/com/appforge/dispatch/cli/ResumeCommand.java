package com.appforge.dispatch.cli;

import com.appforge.core.engine.GenerationService;
import com.appforge.core.events.EventBus;
import com.appforge.core.model.GenerationOutcome;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: appforge resume &lt;generation-id&gt;
 * <p>
 * Continues an interrupted generation from its latest checkpoint. Succeeded tasks are
 * kept; tasks that were running restart from scratch.
 */
@Command(name = "resume", mixinStandardHelpOptions = true, description = "Resume a generation from its last checkpoint")
@Component
public class ResumeCommand implements Runnable {

    @Parameters(index = "0", description = "Generation ID")
    private String generationId;

    @Option(names = "--timeout-minutes", description = "Stop waiting after this many minutes (default: ${DEFAULT-VALUE})",
            defaultValue = "30")
    private long timeoutMinutes;

    private final GenerationService generationService;
    private final EventBus eventBus;

    public ResumeCommand(GenerationService generationService, EventBus eventBus) {
        this.generationService = generationService;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        EventBus.Subscription subscription = eventBus.subscribe(generationId, ConsoleOutput::event);
        try {
            generationService.resume(generationId);
            GenerationOutcome outcome = generationService.await(generationId, Duration.ofMinutes(timeoutMinutes));
            ConsoleOutput.info("Finished with outcome " + outcome);
        } catch (IllegalArgumentException | IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        } catch (TimeoutException e) {
            ConsoleOutput.error("Timed out after " + timeoutMinutes + " minute(s); cancelling " + generationId);
            generationService.cancel(generationId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            generationService.cancel(generationId);
        } finally {
            subscription.unsubscribe();
        }

        generationService.status(generationId).ifPresent(status -> ConsoleOutput.status(status, false));
    }
}
