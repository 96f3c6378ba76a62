package com.appforge.core.provider;

import com.appforge.core.model.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ProviderErrorClassifierTest {

    private final ProviderErrorClassifier classifier = new ProviderErrorClassifier();

    private ErrorKind kindOf(Throwable error) {
        return classifier.classify("openai", error).kind();
    }

    @Test
    @DisplayName("HTTP 429 is rate limited and carries the Retry-After header")
    void http429() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("Retry-After", "12");
        var error = new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests",
                headers, new byte[0], StandardCharsets.UTF_8);

        ProviderException classified = classifier.classify("openai", error);

        assertEquals(ErrorKind.RATE_LIMITED, classified.kind());
        assertEquals(Duration.ofSeconds(12), classified.retryAfter().orElseThrow());
        assertEquals("openai", classified.provider());
    }

    @Test
    @DisplayName("server errors and request timeouts are transient, other client errors permanent")
    void httpStatuses() {
        assertEquals(ErrorKind.TRANSIENT, kindOf(new HttpServerErrorException(HttpStatus.BAD_GATEWAY)));
        assertEquals(ErrorKind.TRANSIENT, kindOf(new HttpClientErrorException(HttpStatus.REQUEST_TIMEOUT)));
        assertEquals(ErrorKind.PERMANENT, kindOf(new HttpClientErrorException(HttpStatus.UNAUTHORIZED)));
        assertEquals(ErrorKind.PERMANENT, kindOf(new HttpClientErrorException(HttpStatus.BAD_REQUEST)));
    }

    @Test
    @DisplayName("Spring AI exceptions are classified from their message")
    void springAiExceptions() {
        ProviderException throttled = classifier.classify("anthropic",
                new NonTransientAiException("429 - rate limit exceeded, retry-after: 2.5"));
        assertEquals(ErrorKind.RATE_LIMITED, throttled.kind());
        assertEquals(Duration.ofMillis(2500), throttled.retryAfter().orElseThrow());

        assertEquals(ErrorKind.PERMANENT, kindOf(new NonTransientAiException("401 - invalid api key")));
        assertEquals(ErrorKind.TRANSIENT, kindOf(new TransientAiException("503 - overloaded")));
    }

    @Test
    @DisplayName("an exhausted billing quota is permanent even though it arrives as a 429")
    void quotaExhausted() {
        assertEquals(ErrorKind.PERMANENT, kindOf(new NonTransientAiException(
                "429 - You exceeded your current quota, please check your plan and billing details.")));
        assertEquals(ErrorKind.PERMANENT, kindOf(new TransientAiException("insufficient_quota")));

        String body = "{\"error\": {\"type\": \"insufficient_quota\"}}";
        var http = new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests",
                new HttpHeaders(), body.getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
        assertEquals(ErrorKind.PERMANENT, kindOf(http));
    }

    @Test
    @DisplayName("a per-minute quota is throttling, not exhaustion")
    void perMinuteQuota() {
        assertEquals(ErrorKind.RATE_LIMITED, kindOf(new NonTransientAiException(
                "429 - Quota exceeded for requests per minute")));
    }

    @Test
    @DisplayName("network failures are transient, wherever they sit in the cause chain")
    void networkFailures() {
        assertEquals(ErrorKind.TRANSIENT, kindOf(new ResourceAccessException("I/O error")));
        assertEquals(ErrorKind.TRANSIENT, kindOf(new TimeoutException()));
        assertEquals(ErrorKind.TRANSIENT, kindOf(new UncheckedIOException(new IOException("reset"))));
    }

    @Test
    @DisplayName("programming errors are permanent and unknown errors transient")
    void fallbackClassification() {
        assertEquals(ErrorKind.PERMANENT, kindOf(new IllegalArgumentException("bad option")));
        assertEquals(ErrorKind.TRANSIENT, kindOf(new IllegalStateException("strange")));
    }

    @Test
    @DisplayName("already classified failures pass through unchanged")
    void passThrough() {
        var original = new ProviderException(ErrorKind.INVALID_OUTPUT, "openai", "no files");
        assertSame(original, classifier.classify("openai", new RuntimeException("wrapper", original)));
    }

    @Test
    @DisplayName("retry hints are parsed from headers and text")
    void retryHints() {
        assertEquals(Duration.ofSeconds(30), ProviderErrorClassifier.parseRetryAfterHeader(" 30 "));
        assertNull(ProviderErrorClassifier.parseRetryAfterHeader("Wed, 21 Oct 2015 07:28:00 GMT"));
        assertNull(ProviderErrorClassifier.parseRetryAfterHeader(null));
        assertEquals(Duration.ofMillis(500), ProviderErrorClassifier.retryAfterFromText("Retry-After: 500ms"));
        assertEquals(Duration.ofSeconds(4), ProviderErrorClassifier.retryAfterFromText("please retry after 4s"));
        assertNull(ProviderErrorClassifier.retryAfterFromText("try again later"));
    }
}
