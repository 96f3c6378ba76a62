package com.appforge.core.engine;

import com.appforge.core.events.EventBus;
import com.appforge.core.generator.GeneratorRegistry;
import com.appforge.core.graph.GraphIntegrityException;
import com.appforge.core.graph.TaskGraph;
import com.appforge.core.logging.MdcContext;
import com.appforge.core.metrics.AppforgeMetrics;
import com.appforge.core.model.GenerationOutcome;
import com.appforge.core.model.Task;
import com.appforge.core.provider.ProviderGateway;
import com.appforge.core.resilience.CancellationToken;
import com.appforge.core.resilience.FallbackCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a task graph to a terminal state.
 * <p>
 * Ready tasks are dispatched as soon as their dependencies succeed, up to
 * {@code maxInFlight} at a time; there are no wave barriers. Each dispatched task runs
 * in a {@link TaskExecution} on a fixed worker pool owned by the run. A
 * {@link GraphIntegrityException} raised by any worker aborts the whole run.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final ProviderGateway gateway;
    private final FallbackCoordinator fallback;
    private final GeneratorRegistry generators;
    private final EventBus eventBus;
    private final AppforgeMetrics metrics;
    private final Settings settings;
    private final Clock clock;

    public ExecutionEngine(ProviderGateway gateway, FallbackCoordinator fallback, GeneratorRegistry generators,
                           EventBus eventBus, AppforgeMetrics metrics, Settings settings, Clock clock) {
        this.gateway = gateway;
        this.fallback = fallback;
        this.generators = generators;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
    }

    public GenerationOutcome run(TaskGraph graph) {
        return run(graph, new CancellationToken());
    }

    /**
     * Executes the graph until it is terminal or the token is cancelled.
     *
     * @return the outcome; CANCELLED if the token fired before the graph finished
     * @throws GraphIntegrityException if a worker detected a broken graph invariant
     */
    public GenerationOutcome run(TaskGraph graph, CancellationToken token) {
        String generationId = graph.generationId();
        MdcContext.setGeneration(generationId);
        TaskEventPublisher events = new TaskEventPublisher(eventBus);
        graph.addListener(events);

        ExecutorService workers = Executors.newFixedThreadPool(settings.maxInFlight(),
                namedThreads("appforge-task-" + generationId + "-"));
        CompletionService<String> completions = new ExecutorCompletionService<>(workers);
        Map<String, Future<String>> inFlight = new HashMap<>();
        try {
            log.info("Executing generation {} ({} tasks, max {} in flight)",
                    generationId, graph.tasks().size(), settings.maxInFlight());
            while (!token.isCancelled()) {
                for (Task ready : graph.readyTasks()) {
                    if (inFlight.size() >= settings.maxInFlight()) {
                        break;
                    }
                    if (!inFlight.containsKey(ready.id())) {
                        log.debug("Dispatching task {}", ready.id());
                        inFlight.put(ready.id(), completions.submit(new TaskExecution(graph, ready.id(),
                                generators.forKind(ready.kind()), gateway, fallback, metrics,
                                settings.taskTimeout(), token, clock)));
                    }
                }
                if (inFlight.isEmpty()) {
                    break;
                }
                Future<String> done = completions.poll(settings.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
                if (done != null) {
                    inFlight.remove(collect(done));
                }
            }

            if (token.isCancelled()) {
                drain(completions, inFlight);
                log.info("Generation {} cancelled", generationId);
                return GenerationOutcome.CANCELLED;
            }
            GenerationOutcome outcome = graph.outcome();
            log.info("Generation {} finished: {}", generationId, outcome);
            return outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            log.warn("Generation {} interrupted", generationId);
            return GenerationOutcome.CANCELLED;
        } catch (GraphIntegrityException e) {
            token.cancel();
            log.error("Generation {} aborted: {}", generationId, e.getMessage());
            throw e;
        } finally {
            workers.shutdownNow();
            graph.removeListener(events);
            MdcContext.clear();
        }
    }

    private String collect(Future<String> done) throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof GraphIntegrityException integrity) {
                throw integrity;
            }
            throw new IllegalStateException("Task worker failed unexpectedly", e.getCause());
        }
    }

    /** Waits for cancelled workers to put their tasks back to PENDING. */
    private void drain(CompletionService<String> completions, Map<String, Future<String>> inFlight)
            throws InterruptedException {
        long deadline = System.nanoTime() + settings.taskTimeout().toNanos();
        while (!inFlight.isEmpty()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("{} task(s) did not stop after cancellation: {}", inFlight.size(), inFlight.keySet());
                return;
            }
            Future<String> done = completions.poll(remaining, TimeUnit.NANOSECONDS);
            if (done != null) {
                inFlight.remove(collect(done));
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Engine tuning.
     *
     * @param maxInFlight  maximum tasks executing concurrently
     * @param taskTimeout  wall-clock budget of one task across all its attempts
     * @param pollInterval how often the loop re-checks cancellation while waiting
     */
    public record Settings(int maxInFlight, Duration taskTimeout, Duration pollInterval) {

        public Settings {
            if (maxInFlight < 1) {
                throw new IllegalArgumentException("maxInFlight must be at least 1");
            }
        }
    }
}
