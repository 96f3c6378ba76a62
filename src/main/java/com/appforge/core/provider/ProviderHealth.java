package com.appforge.core.provider;

import com.appforge.core.resilience.CircuitState;
import com.appforge.core.resilience.ProviderCircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live health record for one provider: call counters, latency average, circuit and
 * request budget. Counters are lifetime totals except {@code consecutiveFailures},
 * which resets whenever the circuit closes. {@link #recentFailureRate()} weighs the
 * latest calls most, so a provider that starts failing ranks below a healthy one
 * long before its lifetime totals move.
 */
public class ProviderHealth {

    private static final double LATENCY_ALPHA = 0.1;
    private static final double FAILURE_ALPHA = 0.2;

    private final String provider;
    private final int priority;
    private final ProviderCircuitBreaker circuit;
    private final RateLimiter budget;
    private final RateLimiter tokenBudget;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong totalCalls = new AtomicLong();
    private final AtomicLong totalFailures = new AtomicLong();
    private double averageLatencyMs;
    private double recentFailureRate;

    /**
     * @param tokenBudget tokens per minute, or null when the provider has no token limit
     */
    public ProviderHealth(String provider, int priority, ProviderCircuitBreaker circuit, RateLimiter budget,
                          RateLimiter tokenBudget) {
        this.provider = provider;
        this.priority = priority;
        this.circuit = circuit;
        this.budget = budget;
        this.tokenBudget = tokenBudget;
        circuit.onTransition(this::onCircuitTransition);
    }

    public String provider() {
        return provider;
    }

    /** Position in the configured provider list, lower is preferred. */
    public int priority() {
        return priority;
    }

    public ProviderCircuitBreaker circuit() {
        return circuit;
    }

    /** Consumes one request from the local budget without waiting. */
    public boolean tryConsumeBudget() {
        return budget.acquirePermission();
    }

    /**
     * Consumes {@code tokens} from the token budget without waiting. Requests larger
     * than the whole budget are charged the whole budget.
     */
    public boolean tryConsumeTokens(int tokens) {
        if (tokenBudget == null) {
            return true;
        }
        int limit = tokenBudget.getRateLimiterConfig().getLimitForPeriod();
        return tokenBudget.acquirePermission(Math.max(1, Math.min(tokens, limit)));
    }

    /** Time until the budget window refreshes. */
    public Duration budgetRefreshPeriod() {
        return budget.getRateLimiterConfig().getLimitRefreshPeriod();
    }

    public void recordSuccess(Duration latency) {
        totalCalls.incrementAndGet();
        consecutiveFailures.set(0);
        update(latency, false);
    }

    public void recordFailure(Duration latency) {
        totalCalls.incrementAndGet();
        totalFailures.incrementAndGet();
        consecutiveFailures.incrementAndGet();
        update(latency, true);
    }

    private void onCircuitTransition(CircuitState to) {
        if (to == CircuitState.CLOSED) {
            consecutiveFailures.set(0);
        }
    }

    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    public long totalCalls() {
        return totalCalls.get();
    }

    public long totalFailures() {
        return totalFailures.get();
    }

    public synchronized double averageLatencyMs() {
        return averageLatencyMs;
    }

    /** Exponentially weighted share of failed calls, between 0 and 1. */
    public synchronized double recentFailureRate() {
        return recentFailureRate;
    }

    public Snapshot snapshot() {
        return new Snapshot(provider, priority, circuit.state(), circuit.lastStateChange(),
                consecutiveFailures(), totalCalls(), totalFailures(), circuit.failureRate(),
                averageLatencyMs(), budget.getMetrics().getAvailablePermissions());
    }

    private synchronized void update(Duration latency, boolean failed) {
        double ms = latency.toNanos() / 1_000_000.0;
        averageLatencyMs = averageLatencyMs == 0 ? ms : LATENCY_ALPHA * ms + (1 - LATENCY_ALPHA) * averageLatencyMs;
        recentFailureRate = FAILURE_ALPHA * (failed ? 1 : 0) + (1 - FAILURE_ALPHA) * recentFailureRate;
    }

    /**
     * Read-only copy of a provider's health for status output.
     */
    public record Snapshot(
        String provider,
        int priority,
        CircuitState circuitState,
        Instant lastStateChange,
        int consecutiveFailures,
        long totalCalls,
        long totalFailures,
        float failureRate,
        double averageLatencyMs,
        int remainingBudget
    ) {}
}
