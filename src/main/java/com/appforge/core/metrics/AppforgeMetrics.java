package com.appforge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for planning and graph execution.
 */
@Service
public class AppforgeMetrics {

    private final MeterRegistry registry;

    public AppforgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("appforge.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPlannedTasks(int count) {
        DistributionSummary.builder("appforge.planning.task_count")
                .description("Tasks per planned graph")
                .register(registry)
                .record(count);
    }

    public void recordTaskResult(String kind, String state, long ms) {
        Timer.builder("appforge.task.duration")
                .tag("kind", kind)
                .tag("state", state)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskAttempts(String kind, int attempts) {
        DistributionSummary.builder("appforge.task.attempts")
                .description("Attempts used per finished task")
                .tag("kind", kind)
                .register(registry)
                .record(attempts);
    }

    public void recordRetry(String kind, String errorKind) {
        Counter.builder("appforge.task.retries")
                .tag("kind", kind)
                .tag("error", errorKind)
                .register(registry)
                .increment();
    }

    // --- Provider resilience ---

    /**
     * Records one provider call.
     *
     * @param provider provider name
     * @param outcome  "success" or the error kind id
     * @param latency  time spent waiting on the provider
     */
    public void recordProviderCall(String provider, String outcome, Duration latency) {
        Timer.builder("appforge.provider.calls")
                .description("Provider calls by outcome")
                .tag("provider", provider)
                .tag("outcome", outcome)
                .register(registry)
                .record(latency);
    }

    /**
     * Records a call refused before reaching the provider.
     *
     * @param reason "circuit_open" or "budget_exhausted"
     */
    public void recordProviderRejection(String provider, String reason) {
        Counter.builder("appforge.provider.rejections")
                .tag("provider", provider)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordCircuitTransition(String provider, String toState) {
        Counter.builder("appforge.circuit.transitions")
                .tag("provider", provider)
                .tag("to", toState)
                .register(registry)
                .increment();
    }

    public void recordFailover(String fromProvider, String toProvider) {
        Counter.builder("appforge.provider.failovers")
                .description("Attempts moved to another provider")
                .tag("from", fromProvider)
                .tag("to", toProvider)
                .register(registry)
                .increment();
    }

    // --- Checkpointing ---

    public void recordCheckpointWrite(boolean success) {
        Counter.builder("appforge.checkpoint.writes")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    public void recordGenerationResult(String outcome) {
        Counter.builder("appforge.generations.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
