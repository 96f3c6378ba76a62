package com.appforge.core.provider;

import com.appforge.core.metrics.AppforgeMetrics;
import com.appforge.core.model.ErrorKind;
import com.appforge.core.resilience.CancellationToken;
import com.appforge.core.resilience.ProviderCircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point for provider calls.
 * <p>
 * Every call passes the provider's circuit breaker and its request and token budgets,
 * runs on the gateway's call pool with a timeout, and is recorded against the
 * provider's health. A call refused by the circuit or a budget never reaches the
 * provider. A provider that reports a rate limit is taken out of rotation until its
 * retry-after hint, or the circuit cooldown, has passed.
 */
public class ProviderGateway implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderGateway.class);

    private final Map<String, LlmProvider> providers = new LinkedHashMap<>();
    private final ProviderHealthRegistry healthRegistry;
    private final ProviderErrorClassifier classifier;
    private final AppforgeMetrics metrics;
    private final ExecutorService callPool;

    public ProviderGateway(List<ProviderRegistration> registrations, ProviderHealthRegistry healthRegistry,
                           ProviderErrorClassifier classifier, AppforgeMetrics metrics) {
        this.healthRegistry = healthRegistry;
        this.classifier = classifier;
        this.metrics = metrics;
        for (ProviderRegistration registration : registrations) {
            LlmProvider provider = registration.provider();
            providers.put(provider.name(), provider);
            healthRegistry.register(provider.name(), registration.requestsPerMinute(),
                    registration.tokensPerMinute());
            log.info("Registered provider {} (priority {}, {} rpm, {} tpm)", provider.name(),
                    providers.size() - 1, registration.requestsPerMinute(), registration.tokensPerMinute());
        }
        this.callPool = Executors.newCachedThreadPool(namedDaemonThreads("appforge-provider-"));
    }

    /** Provider names in priority order. */
    public List<String> providerNames() {
        return List.copyOf(providers.keySet());
    }

    public ProviderHealthRegistry health() {
        return healthRegistry;
    }

    /**
     * Calls a provider.
     *
     * @param providerName provider to call
     * @param prompt       user prompt
     * @param constraints  per-call options
     * @param timeout      maximum time to wait for the provider
     * @param token        cancels the in-flight call when triggered
     * @return the provider's non-blank completion
     * @throws ProviderException     classified failure
     * @throws CancellationException if the token was cancelled during the call
     */
    public String complete(String providerName, String prompt, CompletionConstraints constraints,
                           Duration timeout, CancellationToken token) {
        LlmProvider provider = providers.get(providerName);
        if (provider == null) {
            throw new ProviderException(ErrorKind.PROVIDER_UNAVAILABLE, providerName, "Unknown provider");
        }
        ProviderHealth health = healthRegistry.get(providerName);
        ProviderCircuitBreaker circuit = health.circuit();

        if (!circuit.tryAcquire()) {
            metrics.recordProviderRejection(providerName, "circuit_open");
            log.debug("Circuit for {} is {}, call rejected", providerName, circuit.state());
            throw new ProviderException(ErrorKind.PROVIDER_UNAVAILABLE, providerName,
                    "Circuit is " + circuit.state(), circuit.remainingCooldown());
        }
        if (!health.tryConsumeBudget()) {
            circuit.release();
            metrics.recordProviderRejection(providerName, "budget_exhausted");
            throw new ProviderException(ErrorKind.RATE_LIMITED, providerName,
                    "Local request budget exhausted", health.budgetRefreshPeriod());
        }
        if (!health.tryConsumeTokens(estimateTokens(prompt, constraints))) {
            circuit.release();
            metrics.recordProviderRejection(providerName, "token_budget_exhausted");
            throw new ProviderException(ErrorKind.RATE_LIMITED, providerName,
                    "Local token budget exhausted", health.budgetRefreshPeriod());
        }

        long start = System.nanoTime();
        Future<String> call = callPool.submit(() -> provider.complete(prompt, constraints));
        Runnable cancelCall = () -> call.cancel(true);
        token.onCancel(cancelCall);
        try {
            String content = call.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            if (content == null || content.isBlank()) {
                throw recordFailure(health, new ProviderException(ErrorKind.INVALID_OUTPUT, providerName,
                        "Provider returned empty content"), elapsed);
            }
            circuit.recordSuccess(elapsed);
            health.recordSuccess(elapsed);
            metrics.recordProviderCall(providerName, "success", elapsed);
            return content;
        } catch (TimeoutException e) {
            call.cancel(true);
            throw recordFailure(health, new ProviderException(ErrorKind.TRANSIENT, providerName,
                    "Call timed out after " + timeout.toMillis() + "ms", e), Duration.ofNanos(System.nanoTime() - start));
        } catch (ExecutionException e) {
            throw recordFailure(health, classifier.classify(providerName, e.getCause()),
                    Duration.ofNanos(System.nanoTime() - start));
        } catch (CancellationException e) {
            circuit.release();
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            circuit.release();
            CancellationException cancelled = new CancellationException("Interrupted while calling " + providerName);
            cancelled.initCause(e);
            throw cancelled;
        } finally {
            token.removeCallback(cancelCall);
        }
    }

    private ProviderException recordFailure(ProviderHealth health, ProviderException failure, Duration elapsed) {
        ProviderCircuitBreaker circuit = health.circuit();
        switch (failure.kind()) {
            case TRANSIENT, PROVIDER_UNAVAILABLE -> circuit.recordFailure(elapsed, failure);
            case RATE_LIMITED -> {
                circuit.recordFailure(elapsed, failure);
                circuit.openFor(failure.retryAfter().orElse(circuit.cooldown()));
            }
            // the provider answered, so the circuit sees a healthy call
            case INVALID_OUTPUT -> circuit.recordSuccess(elapsed);
            // caused by the request, not the provider
            case PERMANENT -> circuit.release();
        }
        health.recordFailure(elapsed);
        metrics.recordProviderCall(health.provider(), failure.kind().id(), elapsed);
        log.warn("Provider {} call failed ({}): {}", health.provider(), failure.kind().id(), failure.getMessage());
        return failure;
    }

    /** Rough token count for the budget: four characters per token plus the output limit. */
    static int estimateTokens(String prompt, CompletionConstraints constraints) {
        long chars = prompt == null ? 0 : prompt.length();
        int output = 0;
        if (constraints != null) {
            if (constraints.systemPrompt() != null) {
                chars += constraints.systemPrompt().length();
            }
            if (constraints.maxTokens() != null) {
                output = constraints.maxTokens();
            }
        }
        return (int) Math.min(Integer.MAX_VALUE, chars / 4 + output);
    }

    @Override
    public void close() {
        callPool.shutdownNow();
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * A provider together with its request and token budgets. A token budget of 0
     * means none.
     */
    public record ProviderRegistration(LlmProvider provider, int requestsPerMinute, int tokensPerMinute) {

        public ProviderRegistration(LlmProvider provider, int requestsPerMinute) {
            this(provider, requestsPerMinute, 0);
        }
    }
}
