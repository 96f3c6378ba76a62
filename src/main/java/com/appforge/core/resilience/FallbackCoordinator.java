package com.appforge.core.resilience;

import com.appforge.core.model.ErrorKind;
import com.appforge.core.model.TaskError;
import com.appforge.core.provider.ProviderException;
import com.appforge.core.provider.ProviderHealth;
import com.appforge.core.provider.ProviderHealthRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides how a task recovers from a failed attempt: retry the same provider after a
 * delay, switch to the next healthiest provider, or give up.
 * <p>
 * The attempt budget is shared across providers: a task that failed over still counts
 * every call it made against the limit for the error kind it last hit.
 */
public class FallbackCoordinator {

    private static final Logger log = LoggerFactory.getLogger(FallbackCoordinator.class);

    private static final Comparator<ProviderHealth> HEALTHIEST_FIRST = Comparator
            .comparingInt((ProviderHealth h) -> circuitRank(h.circuit().state()))
            .thenComparingDouble(ProviderHealth::recentFailureRate)
            .thenComparingInt(ProviderHealth::priority);

    private final ProviderHealthRegistry health;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public FallbackCoordinator(ProviderHealthRegistry health, RetryPolicy retryPolicy, Clock clock) {
        this.health = health;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    /**
     * Picks the healthiest callable provider outside {@code exclude}: CLOSED circuits
     * before HALF_OPEN before OPEN-with-elapsed-cooldown, then lowest recent failure
     * rate, then configured priority. A provider inside its retry-after window has an
     * OPEN circuit and is not callable.
     */
    public Optional<String> selectProvider(Set<String> exclude) {
        return health.all().stream()
                .filter(h -> !exclude.contains(h.provider()))
                .filter(h -> h.circuit().isCallable())
                .min(HEALTHIEST_FIRST)
                .map(ProviderHealth::provider);
    }

    /**
     * Decides the next step after a failed attempt.
     *
     * @param provider provider of the failed attempt
     * @param failure  classified failure
     * @param attempts attempts the task has used so far, including the failed one
     * @param deadline instant after which the task may not be retried
     */
    public FallbackDecision decide(String provider, ProviderException failure, int attempts, Instant deadline) {
        ErrorKind kind = failure.kind();
        TaskError error = new TaskError(kind, failure.getMessage(), provider, clock.instant());

        if (!retryPolicy.canRetry(kind, attempts)) {
            log.info("Giving up after {} attempt(s), last error {}", attempts, kind.id());
            return FallbackDecision.fail(error);
        }

        Optional<String> alternative = selectProvider(Set.of(provider));
        FallbackDecision decision = switch (kind) {
            case PROVIDER_UNAVAILABLE -> alternative
                    .map(p -> FallbackDecision.switchTo(p, error))
                    .orElseGet(() -> FallbackDecision.fail(new TaskError(ErrorKind.PROVIDER_UNAVAILABLE,
                            "No healthy provider available", provider, error.occurredAt())));
            case RATE_LIMITED -> alternative
                    .map(p -> FallbackDecision.switchTo(p, error))
                    .orElseGet(() -> retryAfterCooldown(provider, failure, attempts, error));
            case TRANSIENT -> health.get(provider).circuit().isCallable() || alternative.isEmpty()
                    ? retryAfterCooldown(provider, failure, attempts, error)
                    : FallbackDecision.switchTo(alternative.get(), error);
            case INVALID_OUTPUT -> FallbackDecision.retrySame(provider,
                    retryPolicy.delayFor(attempts, kind, null), error);
            case PERMANENT -> FallbackDecision.fail(error);
        };

        if (decision.action() != FallbackDecision.Action.FAIL
                && clock.instant().plus(decision.delay()).isAfter(deadline)) {
            log.info("Next attempt on {} would start after the task deadline, failing", decision.provider());
            return FallbackDecision.fail(error);
        }
        return decision;
    }

    private FallbackDecision retryAfterCooldown(String provider, ProviderException failure,
                                                int attempts, TaskError error) {
        Duration backoff = retryPolicy.delayFor(attempts, failure.kind(), failure.retryAfter().orElse(null));
        Duration cooldown = health.get(provider).circuit().remainingCooldown();
        return FallbackDecision.retrySame(provider, backoff.compareTo(cooldown) >= 0 ? backoff : cooldown, error);
    }

    private static int circuitRank(CircuitState state) {
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }
}
