package com.appforge.core.provider;

import com.appforge.core.config.AppforgeProperties;
import com.appforge.core.metrics.AppforgeMetrics;
import com.appforge.core.resilience.ProviderCircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns the health record, circuit breaker and request budget of every provider.
 * Each instance has its own Resilience4j registries, so separate orchestrators never
 * share breaker state. Lookups do not lock; only registration is serialized.
 */
public class ProviderHealthRegistry {

    private final CircuitBreakerRegistry circuitBreakers;
    private final RateLimiterRegistry rateLimiters = RateLimiterRegistry.ofDefaults();
    private final Duration cooldown;
    private final int failureThreshold;
    private final Clock clock;
    private final AppforgeMetrics metrics;
    private final Map<String, ProviderHealth> health = new ConcurrentHashMap<>();
    private final List<ProviderHealth> ordered = new CopyOnWriteArrayList<>();

    public ProviderHealthRegistry(AppforgeProperties.Circuit circuit, Clock clock, AppforgeMetrics metrics) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(Math.max(circuit.getSlidingWindowSize(), circuit.getFailureThreshold()))
                .minimumNumberOfCalls(circuit.getFailureThreshold())
                .failureRateThreshold(circuit.getFailureRateThreshold())
                .waitDurationInOpenState(circuit.getCooldown())
                .permittedNumberOfCallsInHalfOpenState(1)
                .build();
        this.circuitBreakers = CircuitBreakerRegistry.of(config);
        this.cooldown = circuit.getCooldown();
        this.failureThreshold = circuit.getFailureThreshold();
        this.clock = clock;
        this.metrics = metrics;
    }

    public ProviderHealth register(String provider, int requestsPerMinute) {
        return register(provider, requestsPerMinute, 0);
    }

    /**
     * Registers a provider. Registration order is the configured priority.
     *
     * @param tokensPerMinute token budget per minute, 0 for none
     */
    public synchronized ProviderHealth register(String provider, int requestsPerMinute, int tokensPerMinute) {
        if (health.containsKey(provider)) {
            throw new IllegalArgumentException("Provider already registered: " + provider);
        }
        ProviderCircuitBreaker circuit = new ProviderCircuitBreaker(provider,
                circuitBreakers.circuitBreaker(provider), cooldown, failureThreshold, clock);
        circuit.onTransition(state -> metrics.recordCircuitTransition(provider, state.name()));
        RateLimiter tokenBudget = tokensPerMinute > 0
                ? rateLimiters.rateLimiter(provider + ":tokens", perMinute(tokensPerMinute))
                : null;
        ProviderHealth record = new ProviderHealth(provider, ordered.size(), circuit,
                rateLimiters.rateLimiter(provider, perMinute(requestsPerMinute)), tokenBudget);
        health.put(provider, record);
        ordered.add(record);
        return record;
    }

    public Optional<ProviderHealth> find(String provider) {
        return Optional.ofNullable(health.get(provider));
    }

    public ProviderHealth get(String provider) {
        ProviderHealth record = health.get(provider);
        if (record == null) {
            throw new IllegalArgumentException("Unknown provider: " + provider);
        }
        return record;
    }

    /** Providers in priority order. */
    public List<ProviderHealth> all() {
        return List.copyOf(ordered);
    }

    public List<ProviderHealth.Snapshot> snapshots() {
        return all().stream().map(ProviderHealth::snapshot).toList();
    }

    private static RateLimiterConfig perMinute(int limit) {
        return RateLimiterConfig.custom()
                .limitForPeriod(Math.max(1, limit))
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO)
                .build();
    }
}
