package com.appforge.core.model;

import java.util.Locale;

/**
 * Classification of a failed provider attempt. Drives retry, fallback and circuit
 * accounting.
 */
public enum ErrorKind {
    /** Network blip, timeout, 5xx. Retryable with backoff. */
    TRANSIENT(true),
    /** Provider quota or throttling. Retryable after the provider's hint, prefers failover. */
    RATE_LIMITED(true),
    /** Provider answered but the output could not be used. Retryable with a revised prompt. */
    INVALID_OUTPUT(true),
    /** Authentication, bad request, unsupported feature. Never retried. */
    PERMANENT(false),
    /** Circuit open or provider not callable. Triggers failover. */
    PROVIDER_UNAVAILABLE(true);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
