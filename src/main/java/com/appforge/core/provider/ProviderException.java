package com.appforge.core.provider;

import com.appforge.core.model.ErrorKind;

import java.time.Duration;
import java.util.Optional;

/**
 * A classified failure of a provider attempt.
 */
public class ProviderException extends RuntimeException {

    private final ErrorKind kind;
    private final String provider;
    private final Duration retryAfter;

    public ProviderException(ErrorKind kind, String provider, String message) {
        this(kind, provider, message, null, null);
    }

    public ProviderException(ErrorKind kind, String provider, String message, Duration retryAfter) {
        this(kind, provider, message, retryAfter, null);
    }

    public ProviderException(ErrorKind kind, String provider, String message, Throwable cause) {
        this(kind, provider, message, null, cause);
    }

    public ProviderException(ErrorKind kind, String provider, String message,
                             Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.provider = provider;
        this.retryAfter = retryAfter;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String provider() {
        return provider;
    }

    /** Delay hinted by the provider before the next call, if any. */
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
