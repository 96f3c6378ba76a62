package com.appforge.core.engine;

import com.appforge.core.events.EventBus;
import com.appforge.core.events.GenerationEvent;
import com.appforge.core.graph.GraphSnapshot;
import com.appforge.core.graph.TaskGraph;
import com.appforge.core.logging.MdcContext;
import com.appforge.core.metrics.AppforgeMetrics;
import com.appforge.core.model.GenerationOutcome;
import com.appforge.core.model.GenerationStatus;
import com.appforge.core.model.PlanningConstraints;
import com.appforge.core.model.Task;
import com.appforge.core.persistence.CheckpointStore;
import com.appforge.core.persistence.CheckpointWriter;
import com.appforge.core.planning.PlanningAgent;
import com.appforge.core.planning.PlanningException;
import com.appforge.core.resilience.CancellationToken;
import com.appforge.core.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.Year;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for submitting, observing, resuming and cancelling generations.
 * <p>
 * Planning runs on the caller's thread so planning errors reach the caller directly;
 * execution then continues on the run executor. Every transition is checkpointed, so a
 * generation interrupted here can be resumed in another process from the store.
 */
public class GenerationService {

    private static final Logger log = LoggerFactory.getLogger(GenerationService.class);

    private final PlanningAgent planningAgent;
    private final ExecutionEngine engine;
    private final CheckpointStore checkpointStore;
    private final RetryPolicy checkpointRetry;
    private final EventBus eventBus;
    private final AppforgeMetrics metrics;
    private final Executor runExecutor;
    private final Clock clock;
    private final Map<String, ActiveGeneration> generations = new ConcurrentHashMap<>();

    public GenerationService(PlanningAgent planningAgent, ExecutionEngine engine, CheckpointStore checkpointStore,
                             RetryPolicy checkpointRetry, EventBus eventBus, AppforgeMetrics metrics,
                             Executor runExecutor, Clock clock) {
        this.planningAgent = planningAgent;
        this.engine = engine;
        this.checkpointStore = checkpointStore;
        this.checkpointRetry = checkpointRetry;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.runExecutor = runExecutor;
        this.clock = clock;
    }

    /**
     * Plans the requirement, records the initial checkpoint and starts execution.
     *
     * @return the new generation id
     * @throws PlanningException if the requirement cannot be planned
     */
    public String submit(String requirement, PlanningConstraints constraints) {
        String generationId = generateGenerationId();
        MdcContext.setGeneration(generationId);
        try {
            log.info("Planning generation {}: {}", generationId, requirement);
            TaskGraph graph = planningAgent.plan(generationId, requirement, constraints);
            eventBus.publish(new GenerationEvent("generation.planned", generationId, null,
                    Map.of("tasks", graph.tasks().stream().map(Task::id).toList()), Instant.now()));
            ActiveGeneration active = prepare(graph, true);
            generations.put(generationId, active);
            launch(active);
            return generationId;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Continues a generation from its latest checkpoint. Tasks that were running when
     * the checkpoint was taken restart from PENDING; succeeded tasks are not re-run.
     *
     * @throws IllegalArgumentException if no checkpoint exists for the id
     * @throws IllegalStateException    if the generation is already running here
     */
    public void resume(String generationId) {
        // claimed under the map's lock so two resumes cannot both restore the same run
        ActiveGeneration resumed = generations.compute(generationId, (id, current) -> {
            if (current != null && !current.completion().isDone()) {
                throw new IllegalStateException("Generation " + id + " is already running");
            }
            GraphSnapshot snapshot = checkpointStore.load(id)
                    .orElseThrow(() -> new IllegalArgumentException("No checkpoint found for generation " + id));
            return prepare(TaskGraph.restore(snapshot, clock), false);
        });
        long sequence = resumed.graph().sequence();
        log.info("Resuming generation {} from checkpoint {}", generationId, sequence);
        eventBus.publish(new GenerationEvent("generation.resumed", generationId, null,
                Map.of("sequence", sequence), Instant.now()));
        launch(resumed);
    }

    /**
     * Signals a running generation to stop. In-flight tasks return to PENDING and the
     * run ends with {@link GenerationOutcome#CANCELLED}.
     *
     * @return false if the generation is not running in this process
     */
    public boolean cancel(String generationId) {
        ActiveGeneration active = generations.get(generationId);
        if (active == null || active.completion().isDone()) {
            return false;
        }
        log.info("Cancelling generation {}", generationId);
        active.token().cancel();
        return true;
    }

    /**
     * Current status from the live run if this process has one, otherwise from the
     * latest checkpoint.
     */
    public Optional<GenerationStatus> status(String generationId) {
        ActiveGeneration active = generations.get(generationId);
        if (active != null) {
            CompletableFuture<GenerationOutcome> completion = active.completion();
            GenerationOutcome outcome = completion.isDone() && !completion.isCompletedExceptionally()
                    ? completion.join() : null;
            GraphSnapshot snapshot = active.graph().snapshot();
            return Optional.of(new GenerationStatus(generationId, snapshot.requirement(), snapshot.tasks(),
                    !completion.isDone(), outcome, active.writer().isDegraded(), snapshot.sequence()));
        }
        return checkpointStore.load(generationId).map(snapshot -> {
            TaskGraph graph = TaskGraph.restore(snapshot, clock);
            GenerationOutcome outcome = graph.isTerminal() ? graph.outcome() : null;
            return new GenerationStatus(generationId, snapshot.requirement(), snapshot.tasks(),
                    false, outcome, false, snapshot.sequence());
        });
    }

    /**
     * Blocks until a generation started in this process finishes.
     *
     * @throws IllegalArgumentException if the generation is not known here
     * @throws TimeoutException         if it does not finish in time
     */
    public GenerationOutcome await(String generationId, Duration timeout)
            throws InterruptedException, TimeoutException {
        ActiveGeneration active = generations.get(generationId);
        if (active == null) {
            throw new IllegalArgumentException("Generation " + generationId + " was not started in this process");
        }
        try {
            return active.completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Generation " + generationId + " failed", e.getCause());
        }
    }

    /** Generation ids known to the checkpoint store, sorted. */
    public List<String> history() {
        return checkpointStore.listGenerationIds();
    }

    public List<GenerationEvent> events(String generationId) {
        return eventBus.recentEvents(generationId);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private ActiveGeneration prepare(TaskGraph graph, boolean writeInitialCheckpoint) {
        CheckpointWriter writer = new CheckpointWriter(checkpointStore, checkpointRetry, eventBus, metrics);
        if (writeInitialCheckpoint) {
            writer.write(graph.snapshot());
        }
        graph.addListener(writer);
        return new ActiveGeneration(graph, new CancellationToken(), writer, new CompletableFuture<>());
    }

    private void launch(ActiveGeneration active) {
        TaskGraph graph = active.graph();
        String generationId = graph.generationId();
        CheckpointWriter writer = active.writer();
        CancellationToken token = active.token();
        CompletableFuture<GenerationOutcome> completion = active.completion();

        runExecutor.execute(() -> {
            MdcContext.setGeneration(generationId);
            try {
                eventBus.publish(new GenerationEvent("generation.started", generationId, null,
                        Map.of("sequence", graph.sequence()), Instant.now()));
                GenerationOutcome outcome = engine.run(graph, token);
                metrics.recordGenerationResult(outcome.name());
                eventBus.publish(new GenerationEvent("generation." + outcome.name().toLowerCase(Locale.ROOT),
                        generationId, null, Map.of("outcome", outcome.name(),
                        "degradedDurability", writer.isDegraded()), Instant.now()));
                completion.complete(outcome);
            } catch (RuntimeException e) {
                log.error("Generation {} aborted", generationId, e);
                metrics.recordGenerationResult("ERROR");
                eventBus.publish(new GenerationEvent("generation.aborted", generationId, null,
                        Map.of("reason", String.valueOf(e.getMessage())), Instant.now()));
                completion.completeExceptionally(e);
            } finally {
                graph.removeListener(writer);
                MdcContext.clear();
            }
        });
    }

    private String generateGenerationId() {
        String suffix = UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        return "GEN-" + Year.now(clock).getValue() + "-" + suffix;
    }

    private record ActiveGeneration(
        TaskGraph graph,
        CancellationToken token,
        CheckpointWriter writer,
        CompletableFuture<GenerationOutcome> completion
    ) {}
}
