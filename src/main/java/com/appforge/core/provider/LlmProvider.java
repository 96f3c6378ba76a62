package com.appforge.core.provider;

/**
 * A text-completion backend. Implementations throw {@link ProviderException} or any
 * runtime exception; the gateway classifies whatever escapes.
 */
public interface LlmProvider {

    String name();

    String complete(String prompt, CompletionConstraints constraints);
}
