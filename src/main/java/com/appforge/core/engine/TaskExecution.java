package com.appforge.core.engine;

import com.appforge.core.generator.GenerationContext;
import com.appforge.core.generator.GenerationPrompt;
import com.appforge.core.generator.TaskGenerator;
import com.appforge.core.graph.GraphIntegrityException;
import com.appforge.core.graph.TaskGraph;
import com.appforge.core.logging.MdcContext;
import com.appforge.core.metrics.AppforgeMetrics;
import com.appforge.core.model.ErrorKind;
import com.appforge.core.model.Task;
import com.appforge.core.model.TaskError;
import com.appforge.core.model.TaskResult;
import com.appforge.core.provider.CompletionConstraints;
import com.appforge.core.provider.ProviderException;
import com.appforge.core.provider.ProviderGateway;
import com.appforge.core.resilience.CancellationToken;
import com.appforge.core.resilience.FallbackCoordinator;
import com.appforge.core.resilience.FallbackDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * Runs one task to a terminal state (or back to PENDING on cancellation): selects a
 * provider, calls it through the gateway, and applies the fallback decision after
 * every failed attempt. Returns the task id.
 */
class TaskExecution implements Callable<String> {

    private static final Logger log = LoggerFactory.getLogger(TaskExecution.class);

    private final TaskGraph graph;
    private final String taskId;
    private final TaskGenerator generator;
    private final ProviderGateway gateway;
    private final FallbackCoordinator fallback;
    private final AppforgeMetrics metrics;
    private final Duration taskTimeout;
    private final CancellationToken token;
    private final Clock clock;

    TaskExecution(TaskGraph graph, String taskId, TaskGenerator generator, ProviderGateway gateway,
                  FallbackCoordinator fallback, AppforgeMetrics metrics, Duration taskTimeout,
                  CancellationToken token, Clock clock) {
        this.graph = graph;
        this.taskId = taskId;
        this.generator = generator;
        this.gateway = gateway;
        this.fallback = fallback;
        this.metrics = metrics;
        this.taskTimeout = taskTimeout;
        this.token = token;
        this.clock = clock;
    }

    @Override
    public String call() {
        Task task = graph.task(taskId);
        MdcContext.setTask(graph.generationId(), taskId, task.kind().id());
        Instant started = clock.instant();
        Instant deadline = started.plus(taskTimeout);
        try {
            String provider = fallback.selectProvider(Set.of()).orElse(null);
            TaskError previousError = null;
            while (true) {
                if (token.isCancelled()) {
                    abort();
                    return taskId;
                }
                MdcContext.setProvider(provider);
                Task running = graph.markRunning(taskId, provider);
                log.info("Attempt {} of task {} on {}", running.attempts(), taskId, provider);
                if (provider == null) {
                    fail(new TaskError(ErrorKind.PROVIDER_UNAVAILABLE, "No healthy provider available",
                            null, clock.instant()), started);
                    return taskId;
                }

                try {
                    TaskResult result = attempt(running, provider, previousError, deadline);
                    graph.markSucceeded(taskId, result);
                    finish("succeeded", started);
                    log.info("Task {} succeeded on {} after {} attempt(s)", taskId, provider, running.attempts());
                    return taskId;
                } catch (ProviderException e) {
                    TaskError priorError = previousError;
                    previousError = new TaskError(e.kind(), e.getMessage(), provider, clock.instant());

                    if (!clock.instant().isBefore(deadline)) {
                        ErrorKind kind = priorError != null ? priorError.kind() : ErrorKind.TRANSIENT;
                        fail(new TaskError(kind, "Task timed out after " + taskTimeout.toMillis()
                                + "ms: " + e.getMessage(), provider, clock.instant()), started);
                        return taskId;
                    }

                    FallbackDecision decision = fallback.decide(provider, e, running.attempts(), deadline);
                    switch (decision.action()) {
                        case FAIL -> {
                            fail(decision.error(), started);
                            return taskId;
                        }
                        case SWITCH_PROVIDER -> {
                            graph.markRetrying(taskId, decision.error());
                            metrics.recordRetry(task.kind().id(), e.kind().id());
                            metrics.recordFailover(provider, decision.provider());
                            log.info("Task {} failing over from {} to {} after {}",
                                    taskId, provider, decision.provider(), e.kind().id());
                            provider = decision.provider();
                        }
                        case RETRY_SAME -> {
                            graph.markRetrying(taskId, decision.error());
                            metrics.recordRetry(task.kind().id(), e.kind().id());
                            log.info("Task {} retrying on {} in {}ms after {}",
                                    taskId, provider, decision.delay().toMillis(), e.kind().id());
                            if (token.await(decision.delay())) {
                                abort();
                                return taskId;
                            }
                        }
                    }
                }
            }
        } catch (CancellationException e) {
            abort();
            return taskId;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort();
            return taskId;
        } catch (GraphIntegrityException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Task {} hit an unexpected error", taskId, e);
            if (graph.task(taskId).state().isInFlight()) {
                fail(new TaskError(ErrorKind.PERMANENT, "Unexpected error: " + e.getMessage(),
                        graph.task(taskId).assignedProvider(), clock.instant()), started);
            }
            return taskId;
        } finally {
            MdcContext.clear();
        }
    }

    private TaskResult attempt(Task running, String provider, TaskError previousError, Instant deadline) {
        GenerationPrompt prompt = generator.prompt(running, new GenerationContext(dependencyResults(running), previousError));
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            throw new ProviderException(ErrorKind.TRANSIENT, provider, "No time left before the task deadline");
        }
        String completion = gateway.complete(provider, prompt.user(),
                CompletionConstraints.withSystemPrompt(prompt.system()), remaining, token);
        return generator.render(running, provider, completion);
    }

    private Map<String, TaskResult> dependencyResults(Task task) {
        Map<String, TaskResult> results = new LinkedHashMap<>();
        for (String dep : task.dependencies()) {
            TaskResult result = graph.task(dep).result();
            if (result != null) {
                results.put(dep, result);
            }
        }
        return results;
    }

    private void fail(TaskError error, Instant started) {
        graph.markFailed(taskId, error);
        finish("failed", started);
        log.warn("Task {} failed ({}): {}", taskId, error.kind().id(), error.message());
    }

    private void finish(String state, Instant started) {
        Task task = graph.task(taskId);
        metrics.recordTaskResult(task.kind().id(), state, Duration.between(started, clock.instant()).toMillis());
        metrics.recordTaskAttempts(task.kind().id(), task.attempts());
    }

    private void abort() {
        Task current = graph.task(taskId);
        if (current.state().isInFlight()) {
            graph.abort(taskId);
            log.info("Task {} aborted, returned to PENDING", taskId);
        }
    }
}
