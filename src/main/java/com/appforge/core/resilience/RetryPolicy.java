package com.appforge.core.resilience;

import com.appforge.core.config.AppforgeProperties;
import com.appforge.core.model.ErrorKind;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Exponential backoff with full jitter, per-kind attempt limits and an overall deadline.
 * <p>
 * The ceiling for attempt {@code n} (1-based) is {@code min(baseDelay * 2^(n-1), maxDelay)};
 * the actual delay is drawn uniformly from {@code [0, ceiling]}. A rate-limit hint from
 * the provider replaces the computed delay.
 * <p>
 * The execution engine applies the policy itself through {@link #canRetry} and
 * {@link #delayFor}; other operations run through {@link #execute}, which drives a
 * Resilience4j {@link Retry} with the same limits and delays.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Duration overallDeadline;
    private final Map<ErrorKind, Integer> maxAttempts;
    private final Random random;

    public RetryPolicy(Duration baseDelay, Duration maxDelay, Duration overallDeadline,
                       Map<ErrorKind, Integer> maxAttempts, Random random) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.overallDeadline = overallDeadline;
        this.maxAttempts = new EnumMap<>(maxAttempts);
        this.random = random;
    }

    public static RetryPolicy from(AppforgeProperties.Retry props) {
        return new RetryPolicy(props.getBaseDelay(), props.getMaxDelay(), props.getOverallDeadline(),
                props.getMaxAttempts(), new Random());
    }

    /**
     * Total attempts allowed for an error kind. Non-retryable kinds always get one.
     */
    public int maxAttempts(ErrorKind kind) {
        if (!kind.isRetryable()) {
            return 1;
        }
        return Math.max(1, maxAttempts.getOrDefault(kind, 1));
    }

    public boolean canRetry(ErrorKind kind, int attemptsSoFar) {
        return kind.isRetryable() && attemptsSoFar < maxAttempts(kind);
    }

    public Duration overallDeadline() {
        return overallDeadline;
    }

    /** Upper bound of the jittered delay before attempt {@code attempt + 1}. */
    public Duration ceiling(int attempt) {
        int exponent = Math.min(Math.max(attempt - 1, 0), 30);
        long millis = baseDelay.toMillis() << exponent;
        if (millis < 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param attempt    1-based number of the attempt that just failed
     * @param kind       classification of the failure
     * @param retryAfter provider hint, may be null
     */
    public Duration delayFor(int attempt, ErrorKind kind, Duration retryAfter) {
        if (kind == ErrorKind.RATE_LIMITED && retryAfter != null && !retryAfter.isNegative()) {
            return retryAfter;
        }
        long bound = ceiling(attempt).toMillis();
        if (bound <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(random.nextLong(bound + 1));
    }

    /**
     * Runs an operation, retrying failures the classifier marks retryable until the
     * attempt limit for that kind or the overall deadline is reached.
     *
     * @param operation  name used in log messages and for the Resilience4j retry
     * @param call       the operation to run
     * @param classifier maps a failure to an error kind
     * @return the operation's result
     * @throws Exception the last failure once retries are exhausted
     */
    public <T> T execute(String operation, Callable<T> call,
                         Function<Exception, ErrorKind> classifier) throws Exception {
        long deadline = System.nanoTime() + overallDeadline.toNanos();
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<Duration> nextDelay = new AtomicReference<>(Duration.ZERO);

        Callable<T> guarded = () -> {
            int attempt = attempts.incrementAndGet();
            try {
                return call.call();
            } catch (InterruptedException e) {
                throw new StopRetrying(e);
            } catch (Exception e) {
                ErrorKind kind = classifier.apply(e);
                if (!canRetry(kind, attempt)) {
                    log.warn("{} failed after {} attempt(s) ({}): {}", operation, attempt, kind.id(), e.getMessage());
                    throw new StopRetrying(e);
                }
                Duration delay = delayFor(attempt, kind, null);
                if (System.nanoTime() + delay.toNanos() > deadline) {
                    log.warn("{} abandoned, deadline of {} reached", operation, overallDeadline);
                    throw new StopRetrying(e);
                }
                log.debug("{} attempt {} failed ({}), retrying in {}ms", operation, attempt, kind.id(), delay.toMillis());
                nextDelay.set(delay);
                throw e;
            }
        };

        Retry retry = Retry.of(operation, RetryConfig.<T>custom()
                .maxAttempts(largestAttemptLimit())
                .intervalBiFunction((attempt, outcome) -> nextDelay.get().toMillis())
                .retryOnException(e -> !(e instanceof StopRetrying))
                .build());
        try {
            return retry.executeCallable(guarded);
        } catch (StopRetrying e) {
            throw e.failure();
        }
    }

    private int largestAttemptLimit() {
        int largest = 1;
        for (ErrorKind kind : ErrorKind.values()) {
            largest = Math.max(largest, maxAttempts(kind));
        }
        return largest;
    }

    /** Carries a failure that must not be retried past the Resilience4j retry. */
    private static final class StopRetrying extends RuntimeException {

        StopRetrying(Exception failure) {
            super(failure.getMessage(), failure, false, false);
        }

        Exception failure() {
            return (Exception) getCause();
        }
    }
}
