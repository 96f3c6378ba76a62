package com.appforge.core.provider;

import com.appforge.core.model.ErrorKind;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps exceptions thrown by provider clients onto {@link ErrorKind}s.
 * <p>
 * Spring AI reports HTTP 4xx as {@link NonTransientAiException} and 5xx as
 * {@link TransientAiException}, carrying the status in the message, so throttling
 * is recognised from the message text as well as from raw HTTP exceptions. An
 * exhausted account quota is reported with the same 429 status as throttling but
 * does not clear by waiting, so it is classified permanent.
 */
public class ProviderErrorClassifier {

    private static final Pattern RETRY_AFTER = Pattern.compile(
            "retry[- ]after[\"':= ]+(\\d+(?:\\.\\d+)?)\\s*(ms|s)?", Pattern.CASE_INSENSITIVE);

    public ProviderException classify(String provider, Throwable error) {
        Throwable current = error;
        while (current != null) {
            ProviderException classified = classifyOne(provider, current);
            if (classified != null) {
                return classified;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        String message = error == null ? "unknown provider error" : describe(error);
        return new ProviderException(ErrorKind.TRANSIENT, provider, message, error);
    }

    private ProviderException classifyOne(String provider, Throwable error) {
        if (error instanceof ProviderException pe) {
            return pe;
        }
        String message = describe(error);
        if (error instanceof HttpStatusCodeException http) {
            if (looksQuotaExhausted(message + " " + http.getResponseBodyAsString())) {
                return new ProviderException(ErrorKind.PERMANENT, provider, message, error);
            }
            return fromStatus(provider, http.getStatusCode(), message,
                    parseRetryAfterHeader(http.getResponseHeaders() == null
                            ? null : http.getResponseHeaders().getFirst("Retry-After")), error);
        }
        if ((error instanceof NonTransientAiException || error instanceof TransientAiException)
                && looksQuotaExhausted(message)) {
            return new ProviderException(ErrorKind.PERMANENT, provider, message, error);
        }
        if (error instanceof NonTransientAiException) {
            if (looksRateLimited(message)) {
                return new ProviderException(ErrorKind.RATE_LIMITED, provider, message, retryAfterFromText(message), error);
            }
            return new ProviderException(ErrorKind.PERMANENT, provider, message, error);
        }
        if (error instanceof TransientAiException) {
            if (looksRateLimited(message)) {
                return new ProviderException(ErrorKind.RATE_LIMITED, provider, message, retryAfterFromText(message), error);
            }
            return new ProviderException(ErrorKind.TRANSIENT, provider, message, error);
        }
        if (error instanceof ResourceAccessException || error instanceof TimeoutException
                || error instanceof IOException) {
            return new ProviderException(ErrorKind.TRANSIENT, provider, message, error);
        }
        if (error instanceof IllegalArgumentException || error instanceof UnsupportedOperationException) {
            return new ProviderException(ErrorKind.PERMANENT, provider, message, error);
        }
        return null;
    }

    private ProviderException fromStatus(String provider, HttpStatusCode status, String message,
                                         Duration retryAfter, Throwable error) {
        int code = status.value();
        if (code == 429) {
            return new ProviderException(ErrorKind.RATE_LIMITED, provider, message, retryAfter, error);
        }
        if (status.is5xxServerError() || code == 408) {
            return new ProviderException(ErrorKind.TRANSIENT, provider, message, error);
        }
        return new ProviderException(ErrorKind.PERMANENT, provider, message, error);
    }

    private static boolean looksRateLimited(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("429") || lower.contains("rate limit") || lower.contains("rate_limit")
                || lower.contains("too many requests");
    }

    /** Billing quota used up, as opposed to a per-minute limit that refills. */
    private static boolean looksQuotaExhausted(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("insufficient_quota") || lower.contains("exceeded your current quota")) {
            return true;
        }
        return lower.contains("quota") && !lower.contains("per minute") && !lower.contains("per_minute");
    }

    static Duration parseRetryAfterHeader(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            // HTTP-date form is not used by the providers we call
            return null;
        }
    }

    static Duration retryAfterFromText(String message) {
        Matcher m = RETRY_AFTER.matcher(message);
        if (!m.find()) {
            return null;
        }
        double value = Double.parseDouble(m.group(1));
        if ("ms".equalsIgnoreCase(m.group(2))) {
            return Duration.ofMillis((long) value);
        }
        return Duration.ofMillis((long) (value * 1000));
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
