package com.appforge.core.resilience;

import com.appforge.core.model.TaskError;

import java.time.Duration;

/**
 * What to do after a failed attempt.
 *
 * @param action   chosen recovery
 * @param provider provider for the next attempt, null when failing
 * @param delay    wait before the next attempt
 * @param error    the error that caused this decision
 */
public record FallbackDecision(Action action, String provider, Duration delay, TaskError error) {

    public enum Action {
        RETRY_SAME,
        SWITCH_PROVIDER,
        FAIL
    }

    public static FallbackDecision retrySame(String provider, Duration delay, TaskError error) {
        return new FallbackDecision(Action.RETRY_SAME, provider, delay, error);
    }

    public static FallbackDecision switchTo(String provider, TaskError error) {
        return new FallbackDecision(Action.SWITCH_PROVIDER, provider, Duration.ZERO, error);
    }

    public static FallbackDecision fail(TaskError error) {
        return new FallbackDecision(Action.FAIL, null, Duration.ZERO, error);
    }
}
