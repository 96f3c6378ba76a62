package com.appforge.core.persistence;

import com.appforge.core.events.EventBus;
import com.appforge.core.events.GenerationEvent;
import com.appforge.core.graph.GraphSnapshot;
import com.appforge.core.graph.TaskTransition;
import com.appforge.core.graph.TransitionListener;
import com.appforge.core.metrics.AppforgeMetrics;
import com.appforge.core.model.ErrorKind;
import com.appforge.core.resilience.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Persists a snapshot after every task transition of one generation.
 * <p>
 * Writes run on the transitioning thread while the graph lock is held, so they reach the
 * store in sequence order. A write that still fails after its retries does not stop the
 * run: the generation is flagged as having degraded durability and later transitions
 * keep trying to write.
 */
public class CheckpointWriter implements TransitionListener {

    private static final Logger log = LoggerFactory.getLogger(CheckpointWriter.class);

    private final CheckpointStore store;
    private final RetryPolicy writeRetry;
    private final EventBus eventBus;
    private final AppforgeMetrics metrics;
    private final AtomicBoolean degraded = new AtomicBoolean();
    private volatile boolean lastWriteFailed;

    public CheckpointWriter(CheckpointStore store, RetryPolicy writeRetry, EventBus eventBus, AppforgeMetrics metrics) {
        this.store = store;
        this.writeRetry = writeRetry;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    @Override
    public void onTransition(TaskTransition transition) {
        write(transition.snapshot());
    }

    /**
     * Validates and persists a snapshot.
     *
     * @throws com.appforge.core.graph.GraphIntegrityException if the snapshot records a task
     *         as succeeded while a dependency has not
     */
    public void write(GraphSnapshot snapshot) {
        snapshot.verifyDependencies();
        String generationId = snapshot.generationId();
        try {
            writeRetry.execute("checkpoint " + generationId + "#" + snapshot.sequence(), () -> {
                store.save(generationId, snapshot, snapshot.sequence());
                return null;
            }, e -> e instanceof CheckpointConflictException ? ErrorKind.PERMANENT : ErrorKind.TRANSIENT);
            metrics.recordCheckpointWrite(true);
            if (lastWriteFailed) {
                lastWriteFailed = false;
                log.info("Checkpoint store recovered for generation {} at sequence {}",
                        generationId, snapshot.sequence());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markDegraded(snapshot, e);
        } catch (Exception e) {
            markDegraded(snapshot, e);
        }
    }

    /** True once any checkpoint write for this generation was lost. */
    public boolean isDegraded() {
        return degraded.get();
    }

    private void markDegraded(GraphSnapshot snapshot, Exception cause) {
        lastWriteFailed = true;
        metrics.recordCheckpointWrite(false);
        log.warn("Checkpoint {} for generation {} was not persisted, durability degraded: {}",
                snapshot.sequence(), snapshot.generationId(), cause.getMessage());
        if (degraded.compareAndSet(false, true)) {
            eventBus.publish(new GenerationEvent("checkpoint.degraded", snapshot.generationId(), null,
                    Map.of("sequence", snapshot.sequence(), "reason", String.valueOf(cause.getMessage())),
                    Instant.now()));
        }
    }
}
