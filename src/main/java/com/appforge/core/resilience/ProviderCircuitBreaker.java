package com.appforge.core.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Per-provider circuit breaker backed by a Resilience4j {@link CircuitBreaker}.
 * <p>
 * The breaker opens once the failure rate over the sliding window crosses the
 * threshold after at least {@code failureThreshold} recorded calls, and also after
 * {@code failureThreshold} consecutive failures whatever the window holds. A provider
 * that asks callers to back off is opened for the requested time with
 * {@link #openFor(Duration)}. Once the open period has passed the next acquisition
 * moves the breaker to HALF_OPEN and admits exactly one probe.
 */
public class ProviderCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ProviderCircuitBreaker.class);

    private final String provider;
    private final CircuitBreaker delegate;
    private final Duration cooldown;
    private final int consecutiveFailureThreshold;
    private final Clock clock;
    private final List<Consumer<CircuitState>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile Instant lastStateChange;
    private volatile Instant openUntil = Instant.MIN;

    public ProviderCircuitBreaker(String provider, CircuitBreaker delegate, Duration cooldown,
                                  int consecutiveFailureThreshold, Clock clock) {
        this.provider = provider;
        this.delegate = delegate;
        this.cooldown = cooldown;
        this.consecutiveFailureThreshold = Math.max(1, consecutiveFailureThreshold);
        this.clock = clock;
        this.lastStateChange = clock.instant();
        delegate.getEventPublisher().onStateTransition(event -> {
            CircuitState to = map(event.getStateTransition().getToState());
            lastStateChange = clock.instant();
            if (to == CircuitState.OPEN) {
                openUntil = lastStateChange.plus(cooldown);
            } else if (to == CircuitState.CLOSED) {
                consecutiveFailures.set(0);
            }
            log.info("Circuit for provider {} moved {} -> {}", provider,
                    event.getStateTransition().getFromState(), to);
            listeners.forEach(l -> l.accept(to));
        });
    }

    public String provider() {
        return provider;
    }

    public void onTransition(Consumer<CircuitState> listener) {
        listeners.add(listener);
    }

    /**
     * Asks for permission to call the provider. Returns false while OPEN and the
     * cooldown has not elapsed, or while a HALF_OPEN probe is already in flight.
     */
    public boolean tryAcquire() {
        return delegate.tryAcquirePermission();
    }

    public void recordSuccess(Duration elapsed) {
        consecutiveFailures.set(0);
        delegate.onSuccess(elapsed.toNanos(), TimeUnit.NANOSECONDS);
    }

    public void recordFailure(Duration elapsed, Throwable error) {
        int consecutive = consecutiveFailures.incrementAndGet();
        delegate.onError(elapsed.toNanos(), TimeUnit.NANOSECONDS, error);
        if (consecutive >= consecutiveFailureThreshold) {
            tripIfClosed(consecutive);
        }
    }

    /**
     * Opens the circuit until {@code duration} has passed. An open period that
     * already ends later is kept.
     */
    public synchronized void openFor(Duration duration) {
        Instant until = clock.instant().plus(duration);
        if (state() == CircuitState.OPEN && !until.isAfter(openUntil)) {
            return;
        }
        log.info("Opening circuit for provider {} for {}ms", provider, duration.toMillis());
        delegate.transitionToOpenStateFor(duration);
        openUntil = until;
    }

    public Duration cooldown() {
        return cooldown;
    }

    /** Failures recorded since the last success or close. */
    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    /** Returns an acquired permission without recording an outcome. */
    public void release() {
        delegate.releasePermission();
    }

    public CircuitState state() {
        return map(delegate.getState());
    }

    /** Failure rate in percent over the sliding window, 0 until enough calls are recorded. */
    public float failureRate() {
        return Math.max(0f, delegate.getMetrics().getFailureRate());
    }

    public Instant lastStateChange() {
        return lastStateChange;
    }

    /** Time left before an OPEN circuit admits a probe; zero otherwise. */
    public Duration remainingCooldown() {
        if (state() != CircuitState.OPEN) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), openUntil);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /** True when a call could be admitted right now. */
    public boolean isCallable() {
        return switch (state()) {
            case CLOSED, HALF_OPEN -> true;
            case OPEN -> remainingCooldown().isZero();
        };
    }

    private synchronized void tripIfClosed(int consecutive) {
        if (delegate.getState() == CircuitBreaker.State.CLOSED) {
            log.info("Provider {} failed {} times in a row, opening circuit", provider, consecutive);
            delegate.transitionToOpenState();
        }
    }

    private static CircuitState map(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> CircuitState.OPEN;
            case HALF_OPEN -> CircuitState.HALF_OPEN;
            default -> CircuitState.CLOSED;
        };
    }
}
